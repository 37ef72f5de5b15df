package app.ttable.core.card.domain.dto;

import java.util.List;

/**
 * Ids referenced by the committed standard template that are no longer active.
 */
public record TemplateFreshnessDTO(
        long standardVersionId,
        List<Long> diffGroups,
        List<Long> diffTeachers,
        List<Long> diffDisciplines
) {

    public boolean isFresh() {
        return diffGroups.isEmpty() && diffTeachers.isEmpty() && diffDisciplines.isEmpty();
    }
}
