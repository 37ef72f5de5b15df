package app.ttable.core.card.service;

import app.ttable.core.card.api.VersionLookupPort;
import app.ttable.core.card.api.VersionLookupPort.VersionView;
import app.ttable.core.card.domain.dto.LessonDTO;
import app.ttable.core.card.domain.entity.CardEntity;
import app.ttable.core.card.domain.entity.LessonEntryEntity;
import app.ttable.core.card.domain.request.LessonPayload;
import app.ttable.core.card.domain.type.CardStatus;
import app.ttable.core.card.repository.LessonEntryRepository;
import app.ttable.core.common.error.NotFoundException;
import app.ttable.core.reference.api.ReferenceDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Copies one weekday of the committed standard timetable into another version as draft cards.
 */
@Service
public class TemplateProjectionService {

    private static final Logger log = LoggerFactory.getLogger(TemplateProjectionService.class);

    private final LessonEntryRepository lessonEntryRepository;
    private final CardService cardService;
    private final ConflictDetector conflictDetector;
    private final VersionLookupPort versionLookup;
    private final ReferenceDataProvider referenceDataProvider;

    public TemplateProjectionService(LessonEntryRepository lessonEntryRepository,
                                     CardService cardService,
                                     ConflictDetector conflictDetector,
                                     VersionLookupPort versionLookup,
                                     ReferenceDataProvider referenceDataProvider) {
        this.lessonEntryRepository = lessonEntryRepository;
        this.cardService = cardService;
        this.conflictDetector = conflictDetector;
        this.versionLookup = versionLookup;
        this.referenceDataProvider = referenceDataProvider;
    }

    @Transactional
    public List<LessonDTO> projectWeekday(long buildingId, int weekDay, long targetVersionId, long userId) {
        if (weekDay < 1 || weekDay > 6) {
            throw new IllegalArgumentException("weekDay must be in 1..6: " + weekDay);
        }

        VersionView target = versionLookup.requireEditable(targetVersionId);
        if (target.buildingId() != buildingId) {
            throw new IllegalArgumentException("Version " + targetVersionId + " belongs to another building");
        }

        long standardId = versionLookup.findCommittedStandard(buildingId)
                .orElseThrow(() -> new NotFoundException("Committed standard version for building", buildingId));
        if (standardId == targetVersionId) {
            throw new IllegalArgumentException("Cannot project the standard version onto itself: " + standardId);
        }

        Map<Long, String> groups = referenceDataProvider.activeGroups(buildingId).stream()
                .collect(Collectors.toMap(ReferenceDataProvider.GroupRef::id, ReferenceDataProvider.GroupRef::name, (a, b) -> a));
        Map<Long, String> teachers = referenceDataProvider.activeTeachers().stream()
                .collect(Collectors.toMap(ReferenceDataProvider.TeacherRef::id, ReferenceDataProvider.TeacherRef::fio, (a, b) -> a));
        Map<Long, String> disciplines = referenceDataProvider.activeDisciplines().stream()
                .collect(Collectors.toMap(ReferenceDataProvider.DisciplineRef::id, ReferenceDataProvider.DisciplineRef::title, (a, b) -> a));

        // только пары, где и группа, и преподаватель, и дисциплина ещё активны
        Map<Long, List<LessonPayload>> byGroup = new LinkedHashMap<>();
        int stale = 0;
        for (var row : lessonEntryRepository.findTemplateLessons(standardId, weekDay)) {
            if (!groups.containsKey(row.getGroupId())
                    || !teachers.containsKey(row.getTeacherId())
                    || !disciplines.containsKey(row.getDisciplineId())) {
                stale++;
                continue;
            }
            byGroup.computeIfAbsent(row.getGroupId(), id -> new ArrayList<>())
                    .add(new LessonPayload(
                            weekDay,
                            row.getLessonPosition(),
                            row.getDisciplineId(),
                            row.getTeacherId(),
                            row.getRoom(),
                            Boolean.TRUE.equals(row.getForce())
                    ));
        }

        List<ConflictDetector.CardLessons> batch = new ArrayList<>();
        for (Map.Entry<Long, List<LessonPayload>> entry : byGroup.entrySet()) {
            CardEntity card = cardService.openNextCard(target, entry.getKey(), userId, CardStatus.draft);
            batch.add(new ConflictDetector.CardLessons(card, entry.getValue()));
        }

        ConflictDetector.ConflictReport report =
                conflictDetector.checkAndInsert(target, batch, ConflictDetector.Mode.ALL_OR_NOTHING);
        if (!batch.isEmpty()) {
            versionLookup.touch(targetVersionId);
        }

        log.info("Weekday projected buildingId={} weekDay={} standardVersionId={} targetVersionId={} cards={} lessons={} staleSkipped={}",
                buildingId, weekDay, standardId, targetVersionId, batch.size(), report.inserted().size(), stale);

        List<LessonDTO> result = new ArrayList<>(report.inserted().size());
        for (LessonEntryEntity lesson : report.inserted()) {
            result.add(new LessonDTO(
                    lesson.getId(),
                    lesson.getCardId(),
                    lesson.getWeekDay(),
                    lesson.getPosition(),
                    lesson.getDisciplineId(),
                    disciplines.get(lesson.getDisciplineId()),
                    lesson.getTeacherId(),
                    teachers.get(lesson.getTeacherId()),
                    lesson.getRoom(),
                    lesson.isForce()
            ));
        }
        return result;
    }
}
