package fr.lapetina.congress.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.congress.gateway.domain.exception.CongressApiException;

import java.time.Instant;

/**
 * Uniform HTTP response body: {@code {success, data | error, timestamp}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse {

    private boolean success;
    private Object data;
    private ErrorBody error;
    private Instant timestamp = Instant.now();

    // Getters and setters
    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public Object getData() { return data; }
    public void setData(Object data) { this.data = data; }

    public ErrorBody getError() { return error; }
    public void setError(ErrorBody error) { this.error = error; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public static ApiResponse ok(Object data) {
        ApiResponse api = new ApiResponse();
        api.setSuccess(true);
        api.setData(data);
        return api;
    }

    /**
     * Creates an error response.
     */
    public static ApiResponse error(String code, String message, Object details) {
        ApiResponse api = new ApiResponse();
        api.setSuccess(false);
        api.setError(new ErrorBody(code, message, details));
        return api;
    }

    /**
     * Creates an error response from a gateway error, using its kind's wire code.
     */
    public static ApiResponse fromException(CongressApiException e) {
        return error(e.getKind().getCode(), e.getMessage(), e.getDetails());
    }

    /**
     * Error part of the body. {@code details} carries the upstream body when there is one, as JSON or as raw text.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorBody {
        private String code;
        private String message;
        private Object details;

        public ErrorBody() {
        }

        public ErrorBody(String code, String message, Object details) {
            this.code = code;
            this.message = message;
            this.details = details;
        }

        public String getCode() { return code; }
        public void setCode(String code) { this.code = code; }

        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }

        public Object getDetails() { return details; }
        public void setDetails(Object details) { this.details = details; }
    }
}
