package app.ttable.core.card.api;

import java.util.Optional;

/**
 * What the card package needs to know about timetable versions.
 */
public interface VersionLookupPort {

    record VersionView(long versionId, long buildingId, boolean standard, boolean editable) {}

    VersionView requireVersion(long versionId);

    /**
     * @throws app.ttable.core.common.error.VersionImmutableException if the version is committed and accepted
     */
    VersionView requireEditable(long versionId);

    Optional<Long> findCommittedStandard(long buildingId);

    long createStandard(long buildingId, long userId);

    void touch(long versionId);
}
