package com.docloom.site;

import com.docloom.source.SourceLoadException;

public class SiteLoadException extends SourceLoadException {
    public SiteLoadException(String message) {
        super(message);
    }

    public SiteLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
