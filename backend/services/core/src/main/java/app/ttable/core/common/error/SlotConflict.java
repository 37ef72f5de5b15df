package app.ttable.core.common.error;

/**
 * One occupied slot: the teacher already has a lesson at this position
 * (and weekday, for the standard template) in another group of the same version.
 */
public record SlotConflict(
        Integer weekDay,
        int position,
        long teacherId,
        String teacherName,
        Long existingGroupId,
        String existingGroupName
) {
}
