package app.ttable.core.card.service;

import app.ttable.core.card.api.VersionLookupPort;
import app.ttable.core.card.api.VersionLookupPort.VersionView;
import app.ttable.core.card.domain.dto.BulkAddResult;
import app.ttable.core.card.domain.entity.CardEntity;
import app.ttable.core.card.domain.request.LessonPayload;
import app.ttable.core.card.domain.type.CardStatus;
import app.ttable.core.card.repository.CardRepository;
import app.ttable.core.card.repository.LessonEntryRepository;
import app.ttable.core.common.error.UnknownGroupsException;
import app.ttable.core.reference.api.ReferenceDataProvider.GroupRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Service
public class BulkCardService {

    private static final Logger log = LoggerFactory.getLogger(BulkCardService.class);

    private final CardService cardService;
    private final CardRepository cardRepository;
    private final LessonEntryRepository lessonEntryRepository;
    private final ConflictDetector conflictDetector;
    private final GroupResolver groupResolver;
    private final VersionLookupPort versionLookup;

    public BulkCardService(CardService cardService,
                           CardRepository cardRepository,
                           LessonEntryRepository lessonEntryRepository,
                           ConflictDetector conflictDetector,
                           GroupResolver groupResolver,
                           VersionLookupPort versionLookup) {
        this.cardService = cardService;
        this.cardRepository = cardRepository;
        this.lessonEntryRepository = lessonEntryRepository;
        this.conflictDetector = conflictDetector;
        this.groupResolver = groupResolver;
        this.versionLookup = versionLookup;
    }

    // Одинаковый набор пар сразу для нескольких групп; конфликтные пары пропускаются
    @Transactional
    public BulkAddResult bulkAdd(long versionId, long userId, List<String> groupNames, List<LessonPayload> lessons) {
        VersionView version = versionLookup.requireEditable(versionId);

        GroupResolver.Resolution resolution = groupResolver.resolve(version.buildingId(), groupNames);
        if (resolution.resolved().isEmpty() && !resolution.missing().isEmpty()) {
            log.warn("Bulk add rejected versionId={} unknownGroups={}", versionId, resolution.missing());
            throw new UnknownGroupsException(resolution.missing());
        }

        List<LessonPayload> payload = lessons == null ? List.of() : lessons;
        List<ConflictDetector.CardLessons> batch = new ArrayList<>();
        List<Long> cardIds = new ArrayList<>();
        for (GroupRef group : resolution.resolved()) {
            CardEntity card = cardService.openNextCard(version, group.id(), userId, CardStatus.draft);
            batch.add(new ConflictDetector.CardLessons(card, payload));
            cardIds.add(card.getId());
        }

        ConflictDetector.ConflictReport report =
                conflictDetector.checkAndInsert(version, batch, ConflictDetector.Mode.SKIP_CONFLICTS);
        if (!cardIds.isEmpty()) {
            versionLookup.touch(versionId);
        }

        log.info("Bulk add versionId={} cards={} missingGroups={} skipped={}",
                versionId, cardIds.size(), resolution.missing().size(), report.skipped().size());
        return new BulkAddResult(cardIds, resolution.missing(), report.skipped());
    }

    // Карточки других версий молча игнорируются
    @Transactional
    public int bulkDelete(Collection<Long> cardIds, long versionId) {
        versionLookup.requireEditable(versionId);
        if (cardIds == null || cardIds.isEmpty()) {
            return 0;
        }

        List<CardEntity> cards = cardRepository.findByIdInAndScheduleVersionId(cardIds, versionId);
        if (cards.isEmpty()) {
            return 0;
        }

        List<Long> ids = cards.stream().map(CardEntity::getId).toList();
        lessonEntryRepository.deleteByCardIdIn(ids);
        cardRepository.deleteAllByIdInBatch(ids);
        versionLookup.touch(versionId);

        log.info("Bulk delete versionId={} deleted={}", versionId, ids.size());
        return ids.size();
    }
}
