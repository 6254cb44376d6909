package com.docloom.file;

import com.docloom.source.SourceLoadException;

public class FileLoadException extends SourceLoadException {
    public FileLoadException(String message) {
        super(message);
    }

    public FileLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
