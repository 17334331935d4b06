package com.arrmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Shallow, fail-fast check of a request's input against a tool's declared
 * parameters. Walks the schema, not the input, so undeclared keys pass through.
 * Array elements are not inspected.
 */
public class ParameterValidator {

    public Optional<ParameterViolation> validate(JsonNode input, Map<String, ParamSpec> schema) {
        for (var entry : schema.entrySet()) {
            var name = entry.getKey();
            var spec = entry.getValue();
            var value = input != null ? input.get(name) : null;

            if (value == null) {
                if (spec.required()) return Optional.of(ParameterViolation.missing(name));
                continue;
            }
            if (!matches(value, spec.type())) {
                return Optional.of(ParameterViolation.wrongType(name, spec.type()));
            }
        }
        return Optional.empty();
    }

    static boolean matches(JsonNode value, ParamType type) {
        return switch (type) {
            case STRING -> value.isTextual();
            case NUMBER -> value.isNumber();
            case INTEGER -> isWholeNumber(value);
            case BOOLEAN -> value.isBoolean();
            case ARRAY -> value.isArray();
            case OBJECT -> value.isObject();
        };
    }

    private static boolean isWholeNumber(JsonNode value) {
        if (value.isIntegralNumber()) return true;
        if (!value.isNumber()) return false;
        if (value.isDouble() || value.isFloat()) {
            double d = value.doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        BigDecimal dec = value.decimalValue();
        return dec.signum() == 0 || dec.stripTrailingZeros().scale() <= 0;
    }
}
