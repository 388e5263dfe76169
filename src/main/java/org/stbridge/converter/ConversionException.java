package org.stbridge.converter;

/**
 * Raised when a rule fails unexpectedly. The whole conversion is abandoned; no partial document is returned.
 */
public class ConversionException extends RuntimeException {

    private final String ruleName;

    public ConversionException(String ruleName, Throwable cause) {
        super("Conversion failed in " + ruleName + ": " + cause.getMessage(), cause);
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }
}
