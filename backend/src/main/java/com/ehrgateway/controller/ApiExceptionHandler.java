package com.ehrgateway.controller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.ehrgateway.exception.MissingBearerTokenException;
import com.ehrgateway.exception.OAuthRequestException;
import com.ehrgateway.exception.UpstreamHttpException;
import com.ehrgateway.exception.UpstreamTransportException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Error responses of the gateway.
 *
 * Local errors use a {"detail": ...} body. OpenEMR errors are relayed with
 * the upstream status code and body untouched.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class ApiExceptionHandler {

    private final ObjectMapper objectMapper;

    @ExceptionHandler(MissingBearerTokenException.class)
    public ResponseEntity<Map<String, Object>> handleMissingToken(MissingBearerTokenException ex) {
        return detail(HttpStatus.UNAUTHORIZED, ex.getMessage());
    }

    @ExceptionHandler(OAuthRequestException.class)
    public ResponseEntity<Map<String, Object>> handleOAuthRequest(OAuthRequestException ex) {
        return detail(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(UpstreamHttpException.class)
    public ResponseEntity<JsonNode> handleUpstreamHttp(UpstreamHttpException ex) {
        return ResponseEntity.status(ex.getStatusCode())
                .contentType(MediaType.APPLICATION_JSON)
                .body(ex.getBody());
    }

    @ExceptionHandler(UpstreamTransportException.class)
    public ResponseEntity<Map<String, Object>> handleUpstreamTransport(UpstreamTransportException ex) {
        log.error("OpenEMR request failed: {}", ex.getMessage());
        return detail(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
        Object target = ex.getBindingResult().getTarget();
        List<Map<String, Object>> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> toValidationError(target, error))
                .toList();
        return unprocessable(errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return unprocessable(List.of(validationError(List.of("body"), "Invalid or missing request body", "value_error.jsondecode")));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return unprocessable(List.of(validationError(List.of("query", ex.getParameterName()), "field required", "value_error.missing")));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String type = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName().toLowerCase() : "value";
        return unprocessable(List.of(validationError(List.of("query", ex.getName()), "value is not a valid " + type, "type_error." + type)));
    }

    private Map<String, Object> toValidationError(Object target, FieldError error) {
        return validationError(List.of("body", wireName(target, error.getField())), error.getDefaultMessage(),
                "value_error." + error.getCode());
    }

    // report the JSON property name the client sent, not the Java field name
    private String wireName(Object target, String field) {
        if (target == null) {
            return field;
        }
        JavaType type = objectMapper.constructType(target.getClass());
        return objectMapper.getDeserializationConfig().introspect(type).findProperties().stream()
                .filter(property -> field.equals(property.getInternalName()))
                .map(BeanPropertyDefinition::getName)
                .findFirst()
                .orElse(field);
    }

    private static Map<String, Object> validationError(List<String> loc, String msg, String type) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("loc", loc);
        error.put("msg", msg);
        error.put("type", type);
        return error;
    }

    private static ResponseEntity<Map<String, Object>> unprocessable(List<Map<String, Object>> errors) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("detail", errors));
    }

    private static ResponseEntity<Map<String, Object>> detail(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("detail", message));
    }
}
