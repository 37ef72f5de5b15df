package app.ttable.core.card.domain.dto;

import app.ttable.core.common.error.SlotConflict;

import java.util.List;

public record ImportResult(
        long versionId,
        List<Long> cardIds,
        List<String> unknownGroups,
        List<SlotConflict> skipped
) {
}
