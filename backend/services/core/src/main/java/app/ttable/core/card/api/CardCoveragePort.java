package app.ttable.core.card.api;

import java.util.Set;

/**
 * Answers which groups already have a usable card in a version.
 * A group counts as covered when its current card is accepted or still a draft.
 */
public interface CardCoveragePort {

    Set<Long> coveredGroupIds(long versionId);
}
