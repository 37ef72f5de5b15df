package app.ttable.core.card.domain.dto;

import app.ttable.core.common.error.SlotConflict;

import java.util.List;

public record BulkAddResult(
        List<Long> cardIds,
        List<String> missingGroups,
        List<SlotConflict> skipped
) {
}
