package com.teamA.cra.common.request;

public class RequestNotFoundException extends RuntimeException {

    private final String requestId;

    public RequestNotFoundException(String requestId) {
        super("Request not found: " + requestId);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
