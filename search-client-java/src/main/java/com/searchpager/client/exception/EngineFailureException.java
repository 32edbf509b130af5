package com.searchpager.client.exception;

import java.util.Map;

/**
 * The engine answered with a non-success status.
 *
 * <p>{@link #getErrorBody()} holds the engine's structured error document as parsed
 * from the response, or an empty map when the failure came without a body.
 */
public class EngineFailureException extends SearchClientException {

    private static final long serialVersionUID = 1L;

    private final String index;
    private final int status;
    private final String errorType;
    private final String reason;
    private final transient Map<String, Object> errorBody;

    public EngineFailureException(String index, int status, String errorType, String reason,
                                  Map<String, Object> errorBody, String query) {
        super(buildMessage(index, status, errorType, reason, query));
        this.index = index;
        this.status = status;
        this.errorType = errorType;
        this.reason = reason;
        this.errorBody = errorBody == null ? Map.of() : errorBody;
    }

    private static String buildMessage(String index, int status, String errorType, String reason, String query) {
        StringBuilder sb = new StringBuilder("Engine returned status ").append(status)
                .append(" for index [").append(index).append("]");
        if (errorType != null) {
            sb.append(": ").append(errorType);
        }
        if (reason != null) {
            sb.append(" (").append(reason).append(")");
        }
        if (query != null) {
            sb.append(", query: ").append(query);
        }
        return sb.toString();
    }

    public String getIndex() {
        return index;
    }

    public int getStatus() {
        return status;
    }

    public String getErrorType() {
        return errorType;
    }

    public String getReason() {
        return reason;
    }

    public Map<String, Object> getErrorBody() {
        return errorBody;
    }
}
