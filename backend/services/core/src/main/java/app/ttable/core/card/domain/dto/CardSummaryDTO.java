package app.ttable.core.card.domain.dto;

import app.ttable.core.card.domain.type.CardStatus;

import java.time.Instant;

public record CardSummaryDTO(
        Long cardId,
        Instant createdAt,
        Long userId,
        String userName,
        CardStatus status,
        boolean isCurrent
) {
}
