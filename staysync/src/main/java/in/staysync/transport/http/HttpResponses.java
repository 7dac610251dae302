package in.staysync.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.staysync.util.Json;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * JSON response helpers shared by the HTTP handlers.
 */
final class HttpResponses {

    static void sendJson(HttpServerExchange exchange, int status, Object data) {
        String json;
        try {
            json = Json.MAPPER.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to serialize response");
            return;
        }
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    static void sendError(HttpServerExchange exchange, int status, String message) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        String body;
        try {
            body = Json.MAPPER.writeValueAsString(Map.of("error", message == null ? "error" : message));
        } catch (JsonProcessingException e) {
            body = "{\"error\":\"error\"}";
        }
        exchange.getResponseSender().send(body, StandardCharsets.UTF_8);
    }

    static String bearerToken(HttpServerExchange exchange) {
        String header = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (header == null || !header.startsWith("Bearer ")) {
            return null;
        }
        return header.substring(7).trim();
    }

    static String queryParam(HttpServerExchange exchange, String name) {
        var values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String v = values.getFirst();
        return v == null || v.isBlank() ? null : v;
    }

    private HttpResponses() {}
}
