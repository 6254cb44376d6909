package com.docloom.git;

import com.docloom.source.SourceLoadException;

public class GitLoadException extends SourceLoadException {
    public GitLoadException(String message) {
        super(message);
    }

    public GitLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
