package com.scout.core.io;

/**
 * A property file could not be read or does not describe a usable property.
 * Raised at the property boundary so that the batch can continue with the
 * remaining properties.
 */
public class PropertyLoadException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String source;

    public PropertyLoadException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public PropertyLoadException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    /** File name or property id the failure belongs to. */
    public String getSource() {
        return source;
    }
}
