package app.ttable.core.common.error;

public class VersionImmutableException extends TimetableException {

    private final long versionId;

    public VersionImmutableException(long versionId) {
        super(ErrorKind.forbidden, "Timetable version is committed, changes are forbidden: " + versionId);
        this.versionId = versionId;
    }

    public long getVersionId() {
        return versionId;
    }
}
