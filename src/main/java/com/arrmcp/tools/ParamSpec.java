package com.arrmcp.tools;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;
import java.util.Objects;

/**
 * Declared shape of one tool parameter. {@code items} describes array elements
 * and is carried for listing only; the validator does not recurse into it.
 */
@JsonPropertyOrder({"type", "description", "required", "items"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParamSpec(
    ParamType type,
    boolean required,
    String description,
    @JsonIgnore ParamType itemType
) {
    public ParamSpec {
        Objects.requireNonNull(type, "type");
        if (itemType != null && type != ParamType.ARRAY) {
            throw new IllegalArgumentException("items only apply to array parameters");
        }
        description = description != null ? description : "";
    }

    @JsonProperty("items")
    public Map<String, String> items() {
        return itemType == null ? null : Map.of("type", itemType.jsonType());
    }

    public static ParamSpec required(ParamType type, String description) {
        return new ParamSpec(type, true, description, null);
    }

    public static ParamSpec optional(ParamType type, String description) {
        return new ParamSpec(type, false, description, null);
    }

    public static ParamSpec arrayOf(ParamType itemType, boolean required, String description) {
        return new ParamSpec(ParamType.ARRAY, required, description, Objects.requireNonNull(itemType, "itemType"));
    }
}
