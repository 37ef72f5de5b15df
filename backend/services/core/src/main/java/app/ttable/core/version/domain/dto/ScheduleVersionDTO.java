package app.ttable.core.version.domain.dto;

import app.ttable.core.version.domain.type.TimetableKind;
import app.ttable.core.version.domain.type.VersionStatus;

import java.time.Instant;
import java.time.LocalDate;

public record ScheduleVersionDTO(
        Long id,
        Long buildingId,
        LocalDate scheduleDate,
        TimetableKind kind,
        VersionStatus status,
        boolean isCommitted,
        Long createdBy,
        Instant createdAt,
        Instant lastModifiedAt
) {
}
