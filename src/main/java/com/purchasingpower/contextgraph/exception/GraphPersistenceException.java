package com.purchasingpower.contextgraph.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Raised when the persisted graph cannot be written or is malformed on load.
 */
@Getter
public class GraphPersistenceException extends RuntimeException {

    private final Path location;

    public GraphPersistenceException(String message, Path location) {
        super(message + " (" + location + ")");
        this.location = location;
    }

    public GraphPersistenceException(String message, Path location, Throwable cause) {
        super(message + " (" + location + ")", cause);
        this.location = location;
    }
}
