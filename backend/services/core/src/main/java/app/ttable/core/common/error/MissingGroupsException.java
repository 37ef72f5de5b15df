package app.ttable.core.common.error;

import java.util.List;

public class MissingGroupsException extends TimetableException {

    private final long versionId;
    private final List<Long> groupIds;

    public MissingGroupsException(long versionId, List<Long> groupIds) {
        super(ErrorKind.validation, "Timetable version does not cover all active groups: versionId=" + versionId
                + ", missing=" + groupIds);
        this.versionId = versionId;
        this.groupIds = List.copyOf(groupIds);
    }

    public long getVersionId() {
        return versionId;
    }

    public List<Long> getGroupIds() {
        return groupIds;
    }
}
