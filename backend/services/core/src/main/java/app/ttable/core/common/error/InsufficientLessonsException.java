package app.ttable.core.common.error;

public class InsufficientLessonsException extends TimetableException {

    private final long cardId;
    private final int required;
    private final long actual;

    public InsufficientLessonsException(long cardId, int required, long actual) {
        super(ErrorKind.validation, "Insufficient lessons to accept card " + cardId
                + ": required=" + required + ", actual=" + actual);
        this.cardId = cardId;
        this.required = required;
        this.actual = actual;
    }

    public long getCardId() {
        return cardId;
    }

    public int getRequired() {
        return required;
    }

    public long getActual() {
        return actual;
    }
}
