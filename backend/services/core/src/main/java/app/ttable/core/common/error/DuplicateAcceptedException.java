package app.ttable.core.common.error;

public class DuplicateAcceptedException extends TimetableException {

    private final long cardId;
    private final long acceptedCardId;
    private final long groupId;

    public DuplicateAcceptedException(long cardId, long acceptedCardId, long groupId) {
        super(ErrorKind.conflict, "Group already has an accepted card in this version: groupId=" + groupId
                + ", acceptedCardId=" + acceptedCardId);
        this.cardId = cardId;
        this.acceptedCardId = acceptedCardId;
        this.groupId = groupId;
    }

    public long getCardId() {
        return cardId;
    }

    public long getAcceptedCardId() {
        return acceptedCardId;
    }

    public long getGroupId() {
        return groupId;
    }
}
