package io.exprkit.core.config;

/**
 * Thrown when engine configuration cannot be loaded: a missing file, malformed YAML, or a value
 * that fails validation.
 */
public class EngineConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EngineConfigException(String message) {
        super(message);
    }

    public EngineConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
