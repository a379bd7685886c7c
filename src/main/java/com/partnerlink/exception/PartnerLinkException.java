package com.partnerlink.exception;

/**
 * Base class for all errors raised by the partner linking library.
 */
public class PartnerLinkException extends RuntimeException {

    private final String details;

    public PartnerLinkException(String message) {
        this(message, null, null);
    }

    public PartnerLinkException(String message, String details) {
        this(message, details, null);
    }

    public PartnerLinkException(String message, String details, Throwable cause) {
        super(message, cause);
        this.details = details;
    }

    public String getDetails() {
        return details;
    }

    @Override
    public String toString() {
        if (details != null) {
            return getClass().getSimpleName() + ": " + getMessage() + ": " + details;
        }
        return getClass().getSimpleName() + ": " + getMessage();
    }
}
