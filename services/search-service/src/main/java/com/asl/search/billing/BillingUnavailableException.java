package com.asl.search.billing;

public class BillingUnavailableException extends RuntimeException {
    public BillingUnavailableException(String message) {
        super(message);
    }

    public BillingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
