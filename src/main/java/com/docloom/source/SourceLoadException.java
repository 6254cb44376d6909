package com.docloom.source;

/**
 * Failure of one configured source. Fatal to that source's contribution only.
 */
public class SourceLoadException extends Exception {
    public SourceLoadException(String message) {
        super(message);
    }

    public SourceLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
