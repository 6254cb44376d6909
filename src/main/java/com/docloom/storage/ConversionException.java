package com.docloom.storage;

/**
 * A stored value could not be mapped back to its typed field, e.g. an enumeration string that
 * matches no known variant. Never recovered by defaulting.
 */
public class ConversionException extends Exception {
    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
