package berth.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for internal API operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("error") String error,
        @JsonProperty("count") Integer count) {
    /** Success response */
    public static OperationResponse success() {
        return new OperationResponse(true, null, null);
    }

    /** Success with the number of items processed */
    public static OperationResponse success(int count) {
        return new OperationResponse(true, null, count);
    }

    public static OperationResponse error(String error) {
        return new OperationResponse(false, error, null);
    }
}
