package work.lcod.staging.shared;

/**
 * Raised when a manifest, option or template registration cannot be interpreted.
 */
public final class InvalidConfigurationException extends StagingException {
    public InvalidConfigurationException(String message) {
        super("invalid_configuration", message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super("invalid_configuration", message, cause);
    }
}
