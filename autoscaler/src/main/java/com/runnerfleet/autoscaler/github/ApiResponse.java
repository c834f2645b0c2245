package com.runnerfleet.autoscaler.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.runnerfleet.core.util.JsonUtils;
import com.runnerfleet.core.util.SecretRedactor;

/**
 * Status code and body of one provider API call.
 */
public record ApiResponse(int status, String body) {

    public boolean is(int expected) {
        return status == expected;
    }

    public JsonNode json() {
        return JsonUtils.readTree(body == null || body.isEmpty() ? "{}" : body);
    }

    /**
     * Provider error message for log and exception text, sanitized.
     */
    public String errorMessage() {
        try {
            JsonNode message = json().get("message");
            return SecretRedactor.redact(message != null ? message.asText() : "Unknown error");
        } catch (RuntimeException e) {
            return "Unparseable error response";
        }
    }
}
