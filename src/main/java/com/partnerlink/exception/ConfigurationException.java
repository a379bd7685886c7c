package com.partnerlink.exception;

/**
 * Thrown when a matching or linking configuration violates its contract,
 * e.g. a non-positive candidate limit or thresholds outside [0, 1].
 */
public class ConfigurationException extends PartnerLinkException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, String details) {
        super(message, details);
    }

    public ConfigurationException(String message, String details, Throwable cause) {
        super(message, details, cause);
    }
}
