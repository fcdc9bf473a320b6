package com.teamA.cra.common.request;

/**
 * 조건부 쓰기가 재시도 후에도 계속 실패 (동시 수정)
 */
public class RequestConflictException extends RuntimeException {

    public RequestConflictException(String requestId) {
        super("Request was modified concurrently: " + requestId);
    }
}
