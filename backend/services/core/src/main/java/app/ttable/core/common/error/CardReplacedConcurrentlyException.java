package app.ttable.core.common.error;

/**
 * Another writer moved the current card of the group first; the caller should reload the card and retry.
 */
public class CardReplacedConcurrentlyException extends TimetableException {

    private final long versionId;
    private final long groupId;

    public CardReplacedConcurrentlyException(long versionId, long groupId) {
        super(ErrorKind.conflict, "Current card of the group was replaced concurrently: versionId=" + versionId
                + ", groupId=" + groupId);
        this.versionId = versionId;
        this.groupId = groupId;
    }

    public long getVersionId() {
        return versionId;
    }

    public long getGroupId() {
        return groupId;
    }
}
