package com.docloom.source;

public class InvalidSourceException extends Exception {
    public InvalidSourceException(String message) {
        super(message);
    }
}
