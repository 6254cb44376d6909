package com.docloom.github;

import com.docloom.source.SourceLoadException;

public class GitHubFetchException extends SourceLoadException {
    private final int statusCode;

    public GitHubFetchException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public GitHubFetchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP error status returned by the API, or -1 for transport failures and malformed payloads.
     */
    public int statusCode() {
        return statusCode;
    }
}
