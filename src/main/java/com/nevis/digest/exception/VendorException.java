package com.nevis.digest.exception;

public class VendorException extends RuntimeException {

    public VendorException(String message) {
        super(message);
    }

    public VendorException(String message, Throwable cause) {
        super(message, cause);
    }
}
