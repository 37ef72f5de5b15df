package app.ttable.core.version.domain.dto;

import java.util.List;

/**
 * Outcome of the pre-commit check. Only one of {@code missingGroups} / {@code existingActiveVersionId}
 * is meaningful, depending on {@code outcome}.
 */
public record PreCommitResult(
        Outcome outcome,
        long versionId,
        List<Long> missingGroups,
        Long existingActiveVersionId
) {

    public enum Outcome {
        ready,
        missing_groups,
        existing_active_version
    }

    public static PreCommitResult ready(long versionId) {
        return new PreCommitResult(Outcome.ready, versionId, List.of(), null);
    }

    public static PreCommitResult missingGroups(long versionId, List<Long> missingGroups) {
        return new PreCommitResult(Outcome.missing_groups, versionId, List.copyOf(missingGroups), null);
    }

    public static PreCommitResult existingActiveVersion(long versionId, long existingActiveVersionId) {
        return new PreCommitResult(Outcome.existing_active_version, versionId, List.of(), existingActiveVersionId);
    }

    public boolean isReady() {
        return outcome == Outcome.ready;
    }
}
