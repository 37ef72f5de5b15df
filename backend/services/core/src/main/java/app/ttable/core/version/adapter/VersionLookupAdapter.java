package app.ttable.core.version.adapter;

import app.ttable.core.card.api.VersionLookupPort;
import app.ttable.core.version.domain.entity.ScheduleVersionEntity;
import app.ttable.core.version.domain.type.TimetableKind;
import app.ttable.core.version.service.VersionService;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class VersionLookupAdapter implements VersionLookupPort {

    private final VersionService versionService;

    public VersionLookupAdapter(VersionService versionService) {
        this.versionService = versionService;
    }

    @Override
    public VersionView requireVersion(long versionId) {
        return toView(versionService.requireVersion(versionId));
    }

    @Override
    public VersionView requireEditable(long versionId) {
        return toView(versionService.requireEditable(versionId));
    }

    @Override
    public Optional<Long> findCommittedStandard(long buildingId) {
        return versionService.findCommitted(buildingId, TimetableKind.standard)
                .map(ScheduleVersionEntity::getId);
    }

    @Override
    public long createStandard(long buildingId, long userId) {
        return versionService.create(buildingId, null, TimetableKind.standard, userId);
    }

    @Override
    public void touch(long versionId) {
        versionService.touch(versionId);
    }

    private VersionView toView(ScheduleVersionEntity v) {
        return new VersionView(
                v.getId(),
                v.getBuildingId(),
                v.getKind() == TimetableKind.standard,
                v.isEditable()
        );
    }
}
