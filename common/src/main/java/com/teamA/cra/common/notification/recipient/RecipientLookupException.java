package com.teamA.cra.common.notification.recipient;

public class RecipientLookupException extends RuntimeException {

    public RecipientLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
