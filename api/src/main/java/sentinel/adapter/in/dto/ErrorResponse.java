package sentinel.adapter.in.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body returned for every rejected or failed request.
 *
 * @param error     human-readable reason, never containing a secret
 * @param available known service names, only for unknown-service errors
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, List<String> available) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}
