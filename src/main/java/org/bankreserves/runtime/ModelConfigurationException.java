package org.bankreserves.runtime;

/**
 * Thrown when model or batch parameters describe a configuration that cannot be run,
 * for example a non-positive grid dimension or a reserve ratio outside [0, 1].
 * <p>
 * Raised before any simulation step is executed; no partial run is attempted.
 */
public class ModelConfigurationException extends IllegalArgumentException {

    /**
     * Constructs a new configuration exception with the specified detail message.
     * @param message The detail message.
     */
    public ModelConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a new configuration exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ModelConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
