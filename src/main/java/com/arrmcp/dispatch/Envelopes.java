package com.arrmcp.dispatch;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps response frames to their wire envelopes:
 * {@code {"type":"final","result":..}}, {@code {"type":"partial","content":..,"done":..}}
 * and {@code {"type":"error","error":{"message":..,"code":..}}}.
 */
public final class Envelopes {

    private Envelopes() {}

    public static Map<String, Object> toWire(ToolResponse frame) {
        var body = new LinkedHashMap<String, Object>();
        if (frame instanceof ToolResponse.Final f) {
            body.put("type", "final");
            body.put("result", f.result());
        } else if (frame instanceof ToolResponse.Partial p) {
            body.put("type", "partial");
            body.put("content", p.content());
            body.put("done", p.done());
        } else if (frame instanceof ToolResponse.Error e) {
            return error(e.message(), e.code());
        } else {
            throw new IllegalArgumentException("Unknown frame type: " + frame.getClass().getName());
        }
        return body;
    }

    public static Map<String, Object> error(String message, ErrorCode code) {
        var detail = new LinkedHashMap<String, Object>();
        detail.put("message", message);
        if (code != null) detail.put("code", code.wireName());
        var body = new LinkedHashMap<String, Object>();
        body.put("type", "error");
        body.put("error", detail);
        return body;
    }

    public static int httpStatus(ToolResponse frame) {
        return frame instanceof ToolResponse.Error e ? e.code().httpStatus() : 200;
    }
}
