package com.arrmcp.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ParamType {
    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object");

    private final String jsonType;

    ParamType(String jsonType) {
        this.jsonType = jsonType;
    }

    @JsonValue
    public String jsonType() {
        return jsonType;
    }

    @JsonCreator
    public static ParamType fromJsonType(String value) {
        for (var t : values()) {
            if (t.jsonType.equalsIgnoreCase(value)) return t;
        }
        throw new IllegalArgumentException("Unknown parameter type: " + value);
    }

    String withArticle() {
        return switch (this) {
            case INTEGER, ARRAY, OBJECT -> "an " + jsonType;
            default -> "a " + jsonType;
        };
    }
}
