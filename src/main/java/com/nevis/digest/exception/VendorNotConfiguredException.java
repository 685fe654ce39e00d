package com.nevis.digest.exception;

public class VendorNotConfiguredException extends VendorException {

    public VendorNotConfiguredException(String vendor) {
        super(vendor + " service not configured");
    }
}
