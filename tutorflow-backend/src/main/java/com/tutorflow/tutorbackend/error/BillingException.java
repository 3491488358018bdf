package com.tutorflow.tutorbackend.error;

import lombok.Getter;

@Getter
public class BillingException extends RuntimeException {

    private final BillingError error;

    public BillingException(BillingError error, String message) {
        super(message);
        this.error = error;
    }

    public BillingException(BillingError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public ErrorKind getKind() {
        return error.getKind();
    }

    public static BillingException notFound(String what) {
        return new BillingException(BillingError.NOT_FOUND, what + " not found");
    }

    public static BillingException invalid(String message) {
        return new BillingException(BillingError.INVALID_INPUT, message);
    }

    public static BillingException forbidden(String message) {
        return new BillingException(BillingError.FORBIDDEN, message);
    }
}
