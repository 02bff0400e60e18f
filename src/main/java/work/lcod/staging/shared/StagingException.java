package work.lcod.staging.shared;

/**
 * Base failure raised by the staging engine, carrying a stable code alongside the message.
 */
public class StagingException extends RuntimeException {
    private final String code;

    public StagingException(String code, String message) {
        super(message);
        this.code = code;
    }

    public StagingException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
