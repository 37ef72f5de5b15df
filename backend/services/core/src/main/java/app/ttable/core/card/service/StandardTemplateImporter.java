package app.ttable.core.card.service;

import app.ttable.core.card.api.VersionLookupPort;
import app.ttable.core.card.api.VersionLookupPort.VersionView;
import app.ttable.core.card.domain.dto.ImportResult;
import app.ttable.core.card.domain.entity.CardEntity;
import app.ttable.core.card.domain.request.LessonPayload;
import app.ttable.core.card.domain.request.StandardTemplateRow;
import app.ttable.core.card.domain.type.CardStatus;
import app.ttable.core.common.error.UnknownGroupsException;
import app.ttable.core.reference.api.ReferenceDataProvider.GroupRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * Builds a new pending standard version out of an already parsed timetable document.
 */
@Service
public class StandardTemplateImporter {

    private static final Logger log = LoggerFactory.getLogger(StandardTemplateImporter.class);

    private final CardService cardService;
    private final ConflictDetector conflictDetector;
    private final GroupResolver groupResolver;
    private final VersionLookupPort versionLookup;

    public StandardTemplateImporter(CardService cardService,
                                    ConflictDetector conflictDetector,
                                    GroupResolver groupResolver,
                                    VersionLookupPort versionLookup) {
        this.cardService = cardService;
        this.conflictDetector = conflictDetector;
        this.groupResolver = groupResolver;
        this.versionLookup = versionLookup;
    }

    @Transactional
    public ImportResult importStandard(long buildingId, long userId, List<StandardTemplateRow> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("Standard timetable document is empty");
        }

        // группы в порядке первого появления в документе
        Map<String, List<StandardTemplateRow>> rowsByGroup = new LinkedHashMap<>();
        for (StandardTemplateRow row : rows) {
            if (row.groupName() == null || row.groupName().isBlank()) {
                throw new IllegalArgumentException("groupName is required");
            }
            rowsByGroup.computeIfAbsent(row.groupName().trim(), name -> new ArrayList<>()).add(row);
        }

        GroupResolver.Resolution resolution = groupResolver.resolve(buildingId, rowsByGroup.keySet());
        if (resolution.resolved().isEmpty()) {
            log.warn("Standard import rejected buildingId={} unknownGroups={}", buildingId, resolution.missing());
            throw new UnknownGroupsException(resolution.missing());
        }

        long versionId = versionLookup.createStandard(buildingId, userId);
        VersionView version = versionLookup.requireVersion(versionId);

        List<ConflictDetector.CardLessons> batch = new ArrayList<>();
        List<Long> cardIds = new ArrayList<>();
        for (GroupRef group : resolution.resolved()) {
            List<LessonPayload> lessons = new ArrayList<>();
            for (StandardTemplateRow row : rowsByGroup.get(group.name().trim())) {
                if (row.teacherIds() == null) {
                    continue;
                }
                // одна пара на каждого преподавателя строки
                for (Long teacherId : row.teacherIds()) {
                    lessons.add(new LessonPayload(
                            row.weekDay(),
                            row.position(),
                            row.disciplineId(),
                            teacherId,
                            row.room(),
                            false
                    ));
                }
            }
            CardEntity card = cardService.openNextCard(version, group.id(), userId, CardStatus.draft);
            batch.add(new ConflictDetector.CardLessons(card, lessons));
            cardIds.add(card.getId());
        }

        ConflictDetector.ConflictReport report =
                conflictDetector.checkAndInsert(version, batch, ConflictDetector.Mode.SKIP_CONFLICTS);

        log.info("Standard template imported buildingId={} versionId={} cards={} lessons={} unknownGroups={} skipped={}",
                buildingId, versionId, cardIds.size(), report.inserted().size(),
                resolution.missing().size(), report.skipped().size());
        return new ImportResult(versionId, cardIds, resolution.missing(), report.skipped());
    }
}
