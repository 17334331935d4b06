package com.arrmcp.tools;

public record ParameterViolation(String parameter, String reason) {

    static ParameterViolation missing(String parameter) {
        return new ParameterViolation(parameter, "required parameter missing");
    }

    static ParameterViolation wrongType(String parameter, ParamType expected) {
        return new ParameterViolation(parameter, "must be " + expected.withArticle());
    }

    public String message() {
        return reason.startsWith("must ")
            ? "parameter " + parameter + " " + reason
            : reason + ": " + parameter;
    }
}
