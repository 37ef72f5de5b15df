package app.ttable.core.common.error;

import java.util.List;

public class TeacherDoubleBookedException extends TimetableException {

    private final long versionId;
    private final List<SlotConflict> conflicts;

    public TeacherDoubleBookedException(long versionId, List<SlotConflict> conflicts) {
        super(ErrorKind.conflict, "Teacher already has a group at this position: versionId=" + versionId
                + ", conflicts=" + conflicts.size());
        this.versionId = versionId;
        this.conflicts = List.copyOf(conflicts);
    }

    public long getVersionId() {
        return versionId;
    }

    public List<SlotConflict> getConflicts() {
        return conflicts;
    }
}
