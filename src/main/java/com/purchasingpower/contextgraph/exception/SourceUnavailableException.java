package com.purchasingpower.contextgraph.exception;

import lombok.Getter;

/**
 * Raised by an external source that exists but cannot be read or parsed.
 */
@Getter
public class SourceUnavailableException extends RuntimeException {

    private final String sourceName;

    public SourceUnavailableException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }
}
