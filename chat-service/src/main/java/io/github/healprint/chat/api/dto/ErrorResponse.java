package io.github.healprint.chat.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/** Error body returned by the REST layer: a readable title, a stable code and optional details. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String error;
    private String code;
    private Map<String, Object> details;

    public ErrorResponse() {}

    public ErrorResponse(String error, String code, Map<String, Object> details) {
        this.error = error;
        this.code = code;
        this.details = details;
    }

    public static ErrorResponse withDetail(String error, String code, String key, Object value) {
        return new ErrorResponse(error, code, Map.of(key, value));
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public void setDetails(Map<String, Object> details) {
        this.details = details;
    }
}
