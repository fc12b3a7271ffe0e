package sentinel.adapter.in.dto;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import sentinel.core.model.ProxyRequest;

/**
 * JSON body of {@code POST /v1/proxy/{service}}:
 * {@code {"method": "...", "path": "...", "headers": {...}, "body": ...}}.
 *
 * <p>Fields keep their raw JSON form so a wrong type becomes a validation error
 * instead of a deserialization failure.
 */
public record ProxyRequestBody(JsonNode method, JsonNode path, JsonNode headers, JsonNode body) {

    private static final ProxyRequestBody EMPTY = new ProxyRequestBody(null, null, null, null);

    /**
     * Parses the raw request body. A missing, malformed or non-object body yields an
     * empty request.
     */
    public static ProxyRequestBody parse(ObjectMapper mapper, String raw) {
        if (raw == null || raw.isBlank()) {
            return EMPTY;
        }
        final JsonNode root;
        try {
            root = mapper.readTree(raw);
        } catch (Exception e) {
            return EMPTY;
        }
        if (root == null || !root.isObject()) {
            return EMPTY;
        }
        return new ProxyRequestBody(root.get("method"), root.get("path"), root.get("headers"), root.get("body"));
    }

    public ProxyRequest toModel() {
        return new ProxyRequest(text(method), text(path), headerMap(), payload());
    }

    private Map<String, String> headerMap() {
        final Map<String, String> result = new LinkedHashMap<>();
        if (headers == null || !headers.isObject()) {
            return result;
        }
        final var fields = headers.fields();
        while (fields.hasNext()) {
            final var field = fields.next();
            // non-string header values are dropped
            if (field.getValue().isTextual()) {
                result.put(field.getKey(), field.getValue().textValue());
            }
        }
        return result;
    }

    private Optional<ProxyRequest.Payload> payload() {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return Optional.empty();
        }
        if (body.isTextual()) {
            return Optional.of(ProxyRequest.Payload.text(body.textValue()));
        }
        return Optional.of(ProxyRequest.Payload.json(body.toString()));
    }

    private static String text(JsonNode node) {
        return node != null && node.isTextual() ? node.textValue() : null;
    }
}
