package app.ttable.core.version.domain.request;

import app.ttable.core.version.domain.type.TimetableKind;
import app.ttable.core.version.domain.type.VersionStatus;
import org.springframework.data.domain.Sort;

import java.time.LocalDate;

// Любой из фильтров может быть null - тогда он не применяется
public record VersionFilter(
        VersionStatus status,
        TimetableKind kind,
        Boolean committed,
        LocalDate scheduleDate,
        Sort.Direction dateSort
) {

    public static VersionFilter none() {
        return new VersionFilter(null, null, null, null, null);
    }
}
