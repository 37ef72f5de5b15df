package app.ttable.core.common.error;

/**
 * Base type for every business rejection raised by the engine.
 * <p>
 * Callers map {@link #getKind()} onto their own transport (HTTP status, UI message)
 * and read the structured payload from the concrete subclass.
 */
public abstract class TimetableException extends RuntimeException {

    private final ErrorKind kind;

    protected TimetableException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
