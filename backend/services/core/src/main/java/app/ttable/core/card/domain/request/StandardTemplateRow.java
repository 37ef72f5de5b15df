package app.ttable.core.card.domain.request;

import java.util.List;

/**
 * One normalized line of a standard timetable document: a group has a discipline
 * at the given weekday and position, taught by one or more teachers.
 */
public record StandardTemplateRow(
        String groupName,
        int weekDay,
        int position,
        Long disciplineId,
        List<Long> teacherIds,
        String room
) {
}
