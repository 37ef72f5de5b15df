package app.ttable.core.card.service;

import app.ttable.core.card.api.VersionLookupPort.VersionView;
import app.ttable.core.card.domain.entity.CardEntity;
import app.ttable.core.card.domain.entity.LessonEntryEntity;
import app.ttable.core.card.domain.request.LessonPayload;
import app.ttable.core.card.repository.LessonEntryRepository;
import app.ttable.core.common.error.SlotConflict;
import app.ttable.core.common.error.TeacherDoubleBookedException;
import app.ttable.core.reference.api.ReferenceDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Guards the "one teacher, one group per slot" rule for every write path that inserts lessons.
 * <p>
 * A slot is {@code (weekDay, position, teacherId)} inside one version. Only lessons of current cards
 * occupy slots, and lessons marked {@code force} neither occupy nor collide.
 */
@Component
public class ConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    static final String SLOT_INDEX = "ux_lesson_entries_teacher_slot";

    public enum Mode {
        // любой конфликт откатывает всю операцию
        ALL_OR_NOTHING,
        // конфликтные пары выкидываются, остальные сохраняются
        SKIP_CONFLICTS
    }

    public record CardLessons(CardEntity card, List<LessonPayload> lessons) {
    }

    public record ConflictReport(List<LessonEntryEntity> inserted, List<SlotConflict> skipped) {
    }

    private record SlotKey(Integer weekDay, int position, long teacherId) {
    }

    private record Collision(SlotKey slot, Long existingGroupId) {
    }

    private final LessonEntryRepository lessonEntryRepository;
    private final ReferenceDataProvider referenceDataProvider;

    public ConflictDetector(LessonEntryRepository lessonEntryRepository,
                            ReferenceDataProvider referenceDataProvider) {
        this.lessonEntryRepository = lessonEntryRepository;
        this.referenceDataProvider = referenceDataProvider;
    }

    public ConflictReport checkAndInsert(VersionView version, List<CardLessons> batch, Mode mode) {
        List<LessonEntryEntity> candidates = new ArrayList<>();
        Map<LessonEntryEntity, Long> groupOf = new IdentityHashMap<>();
        for (CardLessons item : batch) {
            for (LessonPayload payload : item.lessons()) {
                LessonEntryEntity entry = toEntry(version, item.card(), payload);
                candidates.add(entry);
                groupOf.put(entry, item.card().getGroupId());
            }
        }
        if (candidates.isEmpty()) {
            return new ConflictReport(List.of(), List.of());
        }

        Set<Long> teacherIds = candidates.stream()
                .filter(e -> !e.isForce())
                .map(LessonEntryEntity::getTeacherId)
                .collect(Collectors.toSet());

        Map<SlotKey, Long> occupied = new HashMap<>();
        if (!teacherIds.isEmpty()) {
            for (var slot : lessonEntryRepository.findOccupiedSlots(version.versionId(), teacherIds)) {
                occupied.putIfAbsent(
                        new SlotKey(slot.getWeekDay(), slot.getLessonPosition(), slot.getTeacherId()),
                        slot.getGroupId()
                );
            }
        }

        List<LessonEntryEntity> accepted = new ArrayList<>();
        List<Collision> collisions = new ArrayList<>();
        for (LessonEntryEntity entry : candidates) {
            if (entry.isForce()) {
                accepted.add(entry);
                continue;
            }
            SlotKey key = slotOf(entry);
            Long holder = occupied.get(key);
            if (holder != null) {
                collisions.add(new Collision(key, holder));
                continue;
            }
            // более ранние строки того же пакета тоже занимают слот
            occupied.put(key, groupOf.get(entry));
            accepted.add(entry);
        }

        List<SlotConflict> skipped = List.of();
        if (!collisions.isEmpty()) {
            List<SlotConflict> conflicts = enrich(version, collisions);
            if (mode == Mode.ALL_OR_NOTHING) {
                log.warn("Teacher double booking rejected versionId={} conflicts={}",
                        version.versionId(), conflicts.size());
                throw new TeacherDoubleBookedException(version.versionId(), conflicts);
            }
            log.info("Conflicting lessons skipped versionId={} skipped={}", version.versionId(), conflicts.size());
            skipped = conflicts;
        }

        if (accepted.isEmpty()) {
            return new ConflictReport(List.of(), skipped);
        }

        try {
            List<LessonEntryEntity> saved = lessonEntryRepository.saveAllAndFlush(accepted);
            return new ConflictReport(saved, skipped);
        } catch (DataIntegrityViolationException ex) {
            if (!isSlotViolation(ex)) {
                throw ex;
            }
            // кто-то занял слот между проверкой и вставкой
            List<Collision> raced = accepted.stream()
                    .filter(e -> !e.isForce())
                    .map(e -> new Collision(slotOf(e), null))
                    .toList();
            log.warn("Teacher slot taken concurrently versionId={} lessons={}", version.versionId(), raced.size());
            throw new TeacherDoubleBookedException(version.versionId(), enrich(version, raced));
        }
    }

    private LessonEntryEntity toEntry(VersionView version, CardEntity card, LessonPayload payload) {
        if (payload.position() < 1) {
            throw new IllegalArgumentException("position must be >= 1");
        }
        if (payload.disciplineId() == null || payload.teacherId() == null) {
            throw new IllegalArgumentException("disciplineId and teacherId are required");
        }
        Integer weekDay = null;
        if (version.standard()) {
            weekDay = payload.weekDay();
            if (weekDay == null || weekDay < 1 || weekDay > 6) {
                throw new IllegalArgumentException("weekDay must be in 1..6 for standard versions: " + weekDay);
            }
        }
        return new LessonEntryEntity(
                card.getId(),
                version.versionId(),
                weekDay,
                payload.position(),
                payload.disciplineId(),
                payload.teacherId(),
                payload.room(),
                payload.force(),
                true
        );
    }

    private static SlotKey slotOf(LessonEntryEntity entry) {
        return new SlotKey(entry.getWeekDay(), entry.getPosition(), entry.getTeacherId());
    }

    private List<SlotConflict> enrich(VersionView version, List<Collision> collisions) {
        Map<Long, String> teacherNames = referenceDataProvider.activeTeachers().stream()
                .collect(Collectors.toMap(ReferenceDataProvider.TeacherRef::id,
                        ReferenceDataProvider.TeacherRef::fio, (a, b) -> a));
        Map<Long, String> groupNames = referenceDataProvider.activeGroups(version.buildingId()).stream()
                .collect(Collectors.toMap(ReferenceDataProvider.GroupRef::id,
                        ReferenceDataProvider.GroupRef::name, (a, b) -> a));

        return collisions.stream()
                .map(c -> new SlotConflict(
                        c.slot().weekDay(),
                        c.slot().position(),
                        c.slot().teacherId(),
                        teacherNames.get(c.slot().teacherId()),
                        c.existingGroupId(),
                        c.existingGroupId() == null ? null : groupNames.get(c.existingGroupId())
                ))
                .toList();
    }

    private static boolean isSlotViolation(DataIntegrityViolationException ex) {
        return ConstraintViolations.violates(ex, SLOT_INDEX);
    }
}
