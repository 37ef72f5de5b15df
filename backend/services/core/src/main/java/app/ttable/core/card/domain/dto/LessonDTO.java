package app.ttable.core.card.domain.dto;

public record LessonDTO(
        Long lessonId,
        Long cardId,
        Integer weekDay,
        int position,
        Long disciplineId,
        String disciplineTitle,
        Long teacherId,
        String teacherName,
        String room,
        boolean force
) {
}
