package com.arrmcp.gateway.http;

import com.arrmcp.dispatch.DispatchException;
import com.arrmcp.dispatch.Envelopes;
import com.arrmcp.dispatch.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class GatewayExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GatewayExceptionHandler.class);

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
        log.warn("Invalid request format: {}", ex.getMessage());
        return envelope("Invalid request format", ErrorCode.MALFORMED_REQUEST);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethod(HttpRequestMethodNotSupportedException ex) {
        log.warn("Method not allowed: {}", ex.getMethod());
        return envelope("Method not allowed", ErrorCode.METHOD_NOT_ALLOWED);
    }

    @ExceptionHandler(DispatchException.class)
    public ResponseEntity<Map<String, Object>> handleDispatch(DispatchException ex) {
        return envelope(ex.getMessage(), ex.code());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            var title = framework.getBody().getTitle();
            return ResponseEntity.status(framework.getStatusCode())
                    .body(Envelopes.error(title != null ? title : "Request failed", null));
        }
        log.error("Unhandled error", ex);
        return ResponseEntity.status(500).body(Envelopes.error("Internal server error", ErrorCode.HANDLER_FAILURE));
    }

    private static ResponseEntity<Map<String, Object>> envelope(String message, ErrorCode code) {
        return ResponseEntity.status(code.httpStatus()).body(Envelopes.error(message, code));
    }
}
