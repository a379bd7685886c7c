package com.partnerlink.exception;

/**
 * Thrown when a partner directory snapshot cannot be read.
 */
public class DataFormatException extends PartnerLinkException {

    private final String source;

    public DataFormatException(String message, String source) {
        this(message, source, null);
    }

    public DataFormatException(String message, String source, Throwable cause) {
        super(message, source, cause);
        this.source = source;
    }

    /**
     * Description of the input that failed (file path, resource name, ...), may be null.
     */
    public String getSource() {
        return source;
    }
}
