package app.ttable.core.card.service;

import app.ttable.core.card.api.VersionLookupPort;
import app.ttable.core.card.api.VersionLookupPort.VersionView;
import app.ttable.core.card.domain.dto.CardLessonDTO;
import app.ttable.core.card.domain.dto.CardSummaryDTO;
import app.ttable.core.card.domain.dto.LessonDTO;
import app.ttable.core.card.domain.entity.CardEntity;
import app.ttable.core.card.domain.request.LessonPayload;
import app.ttable.core.card.domain.type.CardStatus;
import app.ttable.core.card.repository.CardRepository;
import app.ttable.core.card.repository.LessonEntryRepository;
import app.ttable.core.common.error.CardReplacedConcurrentlyException;
import app.ttable.core.common.error.DuplicateAcceptedException;
import app.ttable.core.common.error.InsufficientLessonsException;
import app.ttable.core.common.error.NotFoundException;
import app.ttable.core.config.TimetableProps;
import app.ttable.core.reference.api.ReferenceDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class CardService {

    private static final Logger log = LoggerFactory.getLogger(CardService.class);

    static final String CURRENT_CARD_INDEX = "ux_cards_current";

    private final CardRepository cardRepository;
    private final LessonEntryRepository lessonEntryRepository;
    private final ConflictDetector conflictDetector;
    private final VersionLookupPort versionLookup;
    private final ReferenceDataProvider referenceDataProvider;
    private final TimetableProps props;

    public CardService(CardRepository cardRepository,
                       LessonEntryRepository lessonEntryRepository,
                       ConflictDetector conflictDetector,
                       VersionLookupPort versionLookup,
                       ReferenceDataProvider referenceDataProvider,
                       TimetableProps props) {
        this.cardRepository = cardRepository;
        this.lessonEntryRepository = lessonEntryRepository;
        this.conflictDetector = conflictDetector;
        this.versionLookup = versionLookup;
        this.referenceDataProvider = referenceDataProvider;
        this.props = props;
    }

    // Текущие карточки версии вместе с парами
    @Transactional(readOnly = true)
    public List<CardLessonDTO> loadCurrentCards(long versionId) {
        versionLookup.requireVersion(versionId);
        return cardRepository.loadCurrentCardRows(versionId).stream()
                .map(r -> new CardLessonDTO(
                        r.getCardId(),
                        CardStatus.valueOf(r.getCardStatus()),
                        r.getGroupId(),
                        r.getGroupName(),
                        r.getLessonId(),
                        r.getWeekDay(),
                        r.getPosition(),
                        r.getDisciplineId(),
                        r.getDisciplineTitle(),
                        r.getTeacherId(),
                        r.getTeacherName(),
                        r.getRoom(),
                        r.getForce()
                ))
                .toList();
    }

    // Сохранение никогда не меняет карточку на месте: старая уходит в историю, создаётся новая
    @Transactional
    public long saveCard(long cardId, long versionId, long userId, List<LessonPayload> lessons) {
        VersionView version = versionLookup.requireEditable(versionId);
        CardEntity card = requireCard(cardId);

        if (!card.getScheduleVersionId().equals(versionId)) {
            throw new IllegalArgumentException("Card " + cardId + " does not belong to version " + versionId);
        }
        if (!card.isCurrent()) {
            throw new IllegalArgumentException("Card is not current: " + cardId);
        }

        CardEntity next = openNextCard(version, card.getGroupId(), userId, CardStatus.edited);
        conflictDetector.checkAndInsert(
                version,
                List.of(new ConflictDetector.CardLessons(next, lessons == null ? List.of() : lessons)),
                ConflictDetector.Mode.ALL_OR_NOTHING
        );
        versionLookup.touch(versionId);

        log.info("Card saved cardId={} previousCardId={} versionId={} groupId={} lessons={}",
                next.getId(), cardId, versionId, next.getGroupId(), lessons == null ? 0 : lessons.size());
        return next.getId();
    }

    @Transactional
    public void acceptCard(long cardId) {
        CardEntity card = requireCard(cardId);

        Optional<CardEntity> accepted = cardRepository.findFirstByScheduleVersionIdAndGroupIdAndStatus(
                card.getScheduleVersionId(), card.getGroupId(), CardStatus.accepted);
        if (accepted.isPresent()) {
            log.warn("Accept rejected cardId={} groupId={} acceptedCardId={}",
                    cardId, card.getGroupId(), accepted.get().getId());
            throw new DuplicateAcceptedException(cardId, accepted.get().getId(), card.getGroupId());
        }
        if (!card.isCurrent()) {
            throw new IllegalArgumentException("Card is not current: " + cardId);
        }

        versionLookup.requireEditable(card.getScheduleVersionId());

        long lessons = lessonEntryRepository.countByCardId(cardId);
        if (lessons < props.minLessonsPerAccept()) {
            log.warn("Accept rejected cardId={} lessons={} required={}", cardId, lessons, props.minLessonsPerAccept());
            throw new InsufficientLessonsException(cardId, props.minLessonsPerAccept(), lessons);
        }

        card.setStatus(CardStatus.accepted);
        cardRepository.save(card);
        versionLookup.touch(card.getScheduleVersionId());
        log.info("Card accepted cardId={} versionId={} groupId={}", cardId, card.getScheduleVersionId(), card.getGroupId());
    }

    // Вернуть карточку в редактирование, без проверок конфликтов
    @Transactional
    public void switchAsEdit(long cardId) {
        CardEntity card = requireCard(cardId);
        versionLookup.requireEditable(card.getScheduleVersionId());

        card.setStatus(CardStatus.edited);
        cardRepository.save(card);
        log.info("Card switched to edit cardId={} versionId={}", cardId, card.getScheduleVersionId());
    }

    @Transactional(readOnly = true)
    public List<CardSummaryDTO> history(long versionId, long groupId) {
        List<CardEntity> cards = cardRepository.findByScheduleVersionIdAndGroupIdOrderByCurrentDescIdDesc(
                versionId, groupId, PageRequest.of(0, props.historyLimit()));
        if (cards.isEmpty()) {
            return List.of();
        }

        Map<Long, String> userNames = referenceDataProvider.userNames(
                cards.stream().map(CardEntity::getCreatedBy).distinct().toList());

        return cards.stream()
                .map(c -> new CardSummaryDTO(
                        c.getId(),
                        c.getCreatedAt(),
                        c.getCreatedBy(),
                        userNames.get(c.getCreatedBy()),
                        c.getStatus(),
                        c.isCurrent()
                ))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<LessonDTO> content(long cardId) {
        requireCard(cardId);
        return lessonEntryRepository.loadCardLessons(cardId).stream()
                .map(r -> new LessonDTO(
                        r.getLessonId(),
                        r.getCardId(),
                        r.getWeekDay(),
                        r.getPosition(),
                        r.getDisciplineId(),
                        r.getDisciplineTitle(),
                        r.getTeacherId(),
                        r.getTeacherName(),
                        r.getRoom(),
                        Boolean.TRUE.equals(r.getForce())
                ))
                .toList();
    }

    /**
     * Moves the current pointer of a group to a fresh, empty card.
     * <p>
     * The previous current card (if any) and its lessons are switched off and flushed
     * before the new card is inserted, so the partial unique indexes never see two current rows.
     * A concurrent writer that got there first surfaces as {@link CardReplacedConcurrentlyException}.
     */
    @Transactional
    public CardEntity openNextCard(VersionView version, long groupId, long userId, CardStatus status) {
        cardRepository.findByScheduleVersionIdAndGroupIdAndCurrentTrue(version.versionId(), groupId)
                .ifPresent(previous -> {
                    previous.setCurrent(false);
                    cardRepository.saveAndFlush(previous);
                    lessonEntryRepository.releaseByCardId(previous.getId());
                });

        CardEntity next = new CardEntity(
                version.versionId(),
                groupId,
                status,
                true,
                userId,
                Instant.now()
        );
        try {
            return cardRepository.saveAndFlush(next);
        } catch (DataIntegrityViolationException ex) {
            if (!ConstraintViolations.violates(ex, CURRENT_CARD_INDEX)) {
                throw ex;
            }
            log.warn("Current card replaced concurrently versionId={} groupId={}", version.versionId(), groupId);
            throw new CardReplacedConcurrentlyException(version.versionId(), groupId);
        }
    }

    private CardEntity requireCard(long cardId) {
        return cardRepository.findById(cardId)
                .orElseThrow(() -> new NotFoundException("Card", cardId));
    }
}
