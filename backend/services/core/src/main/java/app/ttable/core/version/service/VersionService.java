package app.ttable.core.version.service;

import app.ttable.core.card.api.CardCoveragePort;
import app.ttable.core.common.error.MissingGroupsException;
import app.ttable.core.common.error.NotFoundException;
import app.ttable.core.common.error.VersionImmutableException;
import app.ttable.core.reference.api.ReferenceDataProvider;
import app.ttable.core.version.domain.dto.PreCommitResult;
import app.ttable.core.version.domain.dto.ScheduleVersionDTO;
import app.ttable.core.version.domain.entity.ScheduleVersionEntity;
import app.ttable.core.version.domain.request.VersionFilter;
import app.ttable.core.version.domain.type.TimetableKind;
import app.ttable.core.version.domain.type.VersionStatus;
import app.ttable.core.version.repository.ScheduleVersionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
public class VersionService {

    private static final Logger log = LoggerFactory.getLogger(VersionService.class);

    private final ScheduleVersionRepository versionRepository;
    private final ReferenceDataProvider referenceDataProvider;
    private final CardCoveragePort cardCoveragePort;

    public VersionService(ScheduleVersionRepository versionRepository,
                          ReferenceDataProvider referenceDataProvider,
                          CardCoveragePort cardCoveragePort) {
        this.versionRepository = versionRepository;
        this.referenceDataProvider = referenceDataProvider;
        this.cardCoveragePort = cardCoveragePort;
    }

    // Новая версия всегда создаётся неутверждённой и незакоммиченной
    @Transactional
    public long create(long buildingId, LocalDate scheduleDate, TimetableKind kind, long userId) {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (kind == TimetableKind.replacements && scheduleDate == null) {
            throw new IllegalArgumentException("scheduleDate is required for replacement versions");
        }

        Instant now = Instant.now();
        ScheduleVersionEntity version = new ScheduleVersionEntity(
                buildingId,
                kind == TimetableKind.standard ? null : scheduleDate,
                kind,
                VersionStatus.pending,
                false,
                userId,
                now,
                now
        );
        ScheduleVersionEntity saved = versionRepository.save(version);

        log.info("Timetable version created versionId={} buildingId={} kind={} date={}",
                saved.getId(), buildingId, kind, saved.getScheduleDate());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public ScheduleVersionDTO getVersion(long versionId, long buildingId) {
        return versionRepository.findByIdAndBuildingId(versionId, buildingId)
                .map(this::toDTO)
                .orElseThrow(() -> new NotFoundException("Timetable version", versionId));
    }

    // Список версий корпуса с фильтрами; page начинается с 1
    @Transactional(readOnly = true)
    public Page<ScheduleVersionDTO> listVersions(long buildingId, VersionFilter filter, int page, int limit) {
        if (page < 1 || limit < 1) {
            throw new IllegalArgumentException("page and limit must be >= 1");
        }
        VersionFilter f = filter == null ? VersionFilter.none() : filter;

        Sort sort = f.dateSort() == null
                ? Sort.by(Sort.Direction.DESC, "id")
                : Sort.by(f.dateSort(), "scheduleDate").and(Sort.by(Sort.Direction.DESC, "id"));

        return versionRepository.search(
                buildingId,
                f.status(),
                f.kind(),
                f.committed(),
                f.scheduleDate(),
                PageRequest.of(page - 1, limit, sort)
        ).map(this::toDTO);
    }

    // Какие закоммиченные версии того же корпуса и вида можно заменить этой
    @Transactional(readOnly = true)
    public List<ScheduleVersionDTO> replacementCandidates(long versionId) {
        ScheduleVersionEntity version = requireVersion(versionId);
        return versionRepository
                .findByBuildingIdAndKindAndCommittedTrueAndIdNot(version.getBuildingId(), version.getKind(), version.getId())
                .stream()
                .map(this::toDTO)
                .toList();
    }

    @Transactional(isolation = Isolation.REPEATABLE_READ)
    public PreCommitResult preCommitCheck(long versionId) {
        ScheduleVersionEntity version = requireVersion(versionId);
        if (version.isCommitted()) {
            return PreCommitResult.ready(versionId);
        }

        List<Long> missing = missingGroups(version);
        if (!missing.isEmpty()) {
            log.warn("Pre-commit check failed versionId={} missingGroups={}", versionId, missing);
            return PreCommitResult.missingGroups(versionId, missing);
        }

        Optional<ScheduleVersionEntity> active = versionRepository
                .findFirstByBuildingIdAndKindAndCommittedTrue(version.getBuildingId(), version.getKind());
        if (active.isPresent()) {
            return PreCommitResult.existingActiveVersion(versionId, active.get().getId());
        }

        // заменять нечего - версия сразу становится действующей
        promote(version);
        log.info("Timetable version committed versionId={} buildingId={} kind={} replaced=none",
                versionId, version.getBuildingId(), version.getKind());
        return PreCommitResult.ready(versionId);
    }

    @Transactional(isolation = Isolation.REPEATABLE_READ)
    public void commit(long pendingVersionId, long targetVersionId) {
        if (pendingVersionId == targetVersionId) {
            throw new IllegalArgumentException("Version cannot replace itself: " + pendingVersionId);
        }
        ScheduleVersionEntity pending = requireVersion(pendingVersionId);
        ScheduleVersionEntity target = requireVersion(targetVersionId);

        if (!pending.getBuildingId().equals(target.getBuildingId()) || pending.getKind() != target.getKind()) {
            throw new IllegalArgumentException("Versions belong to different buildings or kinds: pending="
                    + pendingVersionId + ", target=" + targetVersionId);
        }
        if (pending.isCommitted()) {
            throw new VersionImmutableException(pendingVersionId);
        }

        versionRepository.findFirstByBuildingIdAndKindAndCommittedTrue(pending.getBuildingId(), pending.getKind())
                .filter(active -> !active.getId().equals(target.getId()))
                .ifPresent(active -> {
                    throw new IllegalStateException("Another version is committed for this building and kind: "
                            + active.getId());
                });

        List<Long> missing = missingGroups(pending);
        if (!missing.isEmpty()) {
            log.warn("Commit rejected versionId={} missingGroups={}", pendingVersionId, missing);
            throw new MissingGroupsException(pendingVersionId, missing);
        }

        Instant now = Instant.now();
        target.setCommitted(false);
        target.setStatus(VersionStatus.pending);
        target.setLastModifiedAt(now);
        // старая версия должна уйти из индекса до того, как туда попадёт новая
        versionRepository.saveAndFlush(target);

        promote(pending);
        log.info("Timetable version committed versionId={} buildingId={} kind={} replaced={}",
                pendingVersionId, pending.getBuildingId(), pending.getKind(), targetVersionId);
    }

    @Transactional
    public void switchAsPending(long versionId) {
        ScheduleVersionEntity version = requireVersion(versionId);
        if (version.isCommitted()) {
            log.warn("Switch as pending rejected versionId={} committed=true", versionId);
            throw new VersionImmutableException(versionId);
        }
        version.setStatus(VersionStatus.pending);
        version.setLastModifiedAt(Instant.now());
        versionRepository.save(version);
        log.info("Timetable version switched to pending versionId={}", versionId);
    }

    @Transactional(readOnly = true)
    public ScheduleVersionEntity requireVersion(long versionId) {
        return versionRepository.findById(versionId)
                .orElseThrow(() -> new NotFoundException("Timetable version", versionId));
    }

    @Transactional(readOnly = true)
    public ScheduleVersionEntity requireEditable(long versionId) {
        ScheduleVersionEntity version = requireVersion(versionId);
        if (!version.isEditable()) {
            log.warn("Change rejected on committed version versionId={}", versionId);
            throw new VersionImmutableException(versionId);
        }
        return version;
    }

    @Transactional(readOnly = true)
    public Optional<ScheduleVersionEntity> findCommitted(long buildingId, TimetableKind kind) {
        return versionRepository.findFirstByBuildingIdAndKindAndCommittedTrue(buildingId, kind);
    }

    // Любое изменение карточек двигает last_modified_at версии
    @Transactional
    public void touch(long versionId) {
        ScheduleVersionEntity version = requireVersion(versionId);
        version.setLastModifiedAt(Instant.now());
        versionRepository.save(version);
    }

    private List<Long> missingGroups(ScheduleVersionEntity version) {
        Set<Long> covered = cardCoveragePort.coveredGroupIds(version.getId());
        return referenceDataProvider.activeGroups(version.getBuildingId()).stream()
                .map(ReferenceDataProvider.GroupRef::id)
                .filter(id -> !covered.contains(id))
                .sorted()
                .toList();
    }

    private void promote(ScheduleVersionEntity version) {
        version.setCommitted(true);
        version.setStatus(VersionStatus.accepted);
        version.setLastModifiedAt(Instant.now());
        versionRepository.saveAndFlush(version);
    }

    private ScheduleVersionDTO toDTO(ScheduleVersionEntity v) {
        return new ScheduleVersionDTO(
                v.getId(),
                v.getBuildingId(),
                v.getScheduleDate(),
                v.getKind(),
                v.getStatus(),
                v.isCommitted(),
                v.getCreatedBy(),
                v.getCreatedAt(),
                v.getLastModifiedAt()
        );
    }
}
