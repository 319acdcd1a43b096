package com.rgp.adapter.in.web;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rgp.domain.exception.AuthorizationException;
import com.rgp.domain.exception.ErrorKind;
import com.rgp.domain.exception.ProtocolException;
import com.rgp.domain.exception.ValidationException;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.core.json.jackson.DatabindCodec;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Shared request parsing and error mapping for the HTTP handlers
 */
@Slf4j
public final class ApiSupport {

    public static final String CALLER_HEADER = "X-Caller-Id";

    // amounts are whole units; 1.9 must fail instead of binding as 1
    private static final ObjectMapper REQUEST_MAPPER = DatabindCodec.mapper().copy()
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    private ApiSupport() {
    }

    /**
     * Identity of the caller, taken from the {@value #CALLER_HEADER} header
     */
    public static String caller(RoutingContext context) {
        String caller = context.request().getHeader(CALLER_HEADER);
        if (caller == null || caller.isBlank()) {
            throw new AuthorizationException("Header " + CALLER_HEADER + " is required");
        }
        return caller;
    }

    public static <T> T body(RoutingContext context, Class<T> type) {
        JsonObject json;
        try {
            json = context.body().asJsonObject();
        } catch (DecodeException e) {
            throw new ValidationException("Request body is not valid JSON");
        }
        if (json == null) {
            throw new ValidationException("Request body is required");
        }
        try {
            return REQUEST_MAPPER.convertValue(json.getMap(), type);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid request format: " + e.getMessage());
        }
    }

    public static int intParam(RoutingContext context, String name) {
        String value = context.pathParam(name);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be an integer");
        }
    }

    /**
     * Run a use case call and write the JSON response. Protocol failures map to their HTTP status.
     */
    public static <T> void respond(RoutingContext context, int successStatus, String message, Supplier<T> action) {
        try {
            T result = action.get();
            send(context, successStatus, ApiResponse.success(message, result));
        } catch (ProtocolException e) {
            log.warn("{} {} rejected ({}): {}", context.request().method(), context.request().path(),
                    e.getKind(), e.getMessage());
            ApiResponse response = e instanceof ValidationException validation
                    ? ApiResponse.error(e.getKind().getValue(), e.getMessage(), validation.getErrors())
                    : ApiResponse.error(e.getKind().getValue(), e.getMessage(), null);
            send(context, statusFor(e.getKind()), response);
        } catch (RuntimeException e) {
            log.error("{} {} failed", context.request().method(), context.request().path(), e);
            send(context, 500, ApiResponse.error("Internal error: " + e.getMessage()));
        }
    }

    public static int statusFor(ErrorKind kind) {
        switch (kind) {
            case VALIDATION:
                return 400;
            case AUTHORIZATION:
                return 403;
            case NOT_FOUND:
                return 404;
            case STATE:
                return 409;
            case INSUFFICIENT_RESOURCE:
                return 422;
            case TRANSFER:
                return 502;
            default:
                return 500;
        }
    }

    public static void send(RoutingContext context, int statusCode, ApiResponse response) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(JsonObject.mapFrom(response).encode());
    }
}
