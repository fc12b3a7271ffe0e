package sentinel.core.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record ProxyResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {
    public ProxyResponse {
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
    }

    /**
     * First value of a header, matched case-insensitively.
     */
    public Optional<String> header(String name) {
        for (var entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return Optional.of(entry.getValue().get(0));
            }
        }
        return Optional.empty();
    }
}
