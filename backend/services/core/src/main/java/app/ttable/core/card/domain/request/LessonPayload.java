package app.ttable.core.card.domain.request;

// weekDay обязателен для стандартного расписания и игнорируется для замен
public record LessonPayload(
        Integer weekDay,
        int position,
        Long disciplineId,
        Long teacherId,
        String room,
        boolean force
) {
}
