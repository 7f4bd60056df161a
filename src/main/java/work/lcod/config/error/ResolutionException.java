package work.lcod.config.error;

/**
 * Base of every error that aborts a resolution run. Carries a stable machine code next to the message.
 */
public abstract class ResolutionException extends RuntimeException {
    private final String code;

    protected ResolutionException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected ResolutionException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
