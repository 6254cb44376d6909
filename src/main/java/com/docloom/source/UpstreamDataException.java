package com.docloom.source;

/**
 * Provider returned data that violates a structural assumption. Aborts the whole load rather than
 * being isolated to one source.
 */
public class UpstreamDataException extends RuntimeException {
    public UpstreamDataException(String message) {
        super(message);
    }
}
