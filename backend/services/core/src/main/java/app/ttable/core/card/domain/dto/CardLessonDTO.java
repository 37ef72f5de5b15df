package app.ttable.core.card.domain.dto;

import app.ttable.core.card.domain.type.CardStatus;

// Одна строка "карточка + пара"; у пустой карточки поля пары равны null
public record CardLessonDTO(
        Long cardId,
        CardStatus cardStatus,
        Long groupId,
        String groupName,
        Long lessonId,
        Integer weekDay,
        Integer position,
        Long disciplineId,
        String disciplineTitle,
        Long teacherId,
        String teacherName,
        String room,
        Boolean force
) {
}
