package app.ttable.core.card.service;

import app.ttable.core.card.api.VersionLookupPort;
import app.ttable.core.card.api.VersionLookupPort.VersionView;
import app.ttable.core.card.domain.dto.CardSummaryDTO;
import app.ttable.core.card.domain.entity.CardEntity;
import app.ttable.core.card.domain.request.LessonPayload;
import app.ttable.core.card.domain.type.CardStatus;
import app.ttable.core.card.repository.CardRepository;
import app.ttable.core.card.repository.LessonEntryRepository;
import app.ttable.core.common.error.*;
import app.ttable.core.config.TimetableProps;
import app.ttable.core.reference.api.ReferenceDataProvider;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CardServiceTest {

    private static final VersionView VERSION = new VersionView(10L, 1L, false, true);

    @Mock
    CardRepository cardRepository;

    @Mock
    LessonEntryRepository lessonEntryRepository;

    @Mock
    ConflictDetector conflictDetector;

    @Mock
    VersionLookupPort versionLookup;

    @Mock
    ReferenceDataProvider referenceDataProvider;

    CardService cardService;

    @BeforeEach
    void setUp() {
        cardService = new CardService(
                cardRepository,
                lessonEntryRepository,
                conflictDetector,
                versionLookup,
                referenceDataProvider,
                new TimetableProps(2, 50)
        );
    }

    private static CardEntity card(long id, long groupId, CardStatus status, boolean current) {
        CardEntity card = new CardEntity(10L, groupId, status, current, 7L, Instant.now());
        card.setId(id);
        return card;
    }

    private void stubSaveAssignsId(long newId) {
        when(cardRepository.saveAndFlush(any(CardEntity.class))).thenAnswer(inv -> {
            CardEntity c = inv.getArgument(0);
            if (c.getId() == null) {
                c.setId(newId);
            }
            return c;
        });
    }

    @Test
    void saveCard_keepsPreviousCardAsHistoryAndCreatesEditedCard() {
        CardEntity previous = card(1L, 2L, CardStatus.draft, true);
        List<LessonPayload> lessons = List.of(new LessonPayload(null, 1, 100L, 5L, "101", false));

        when(versionLookup.requireEditable(10L)).thenReturn(VERSION);
        when(cardRepository.findById(1L)).thenReturn(Optional.of(previous));
        when(cardRepository.findByScheduleVersionIdAndGroupIdAndCurrentTrue(10L, 2L)).thenReturn(Optional.of(previous));
        stubSaveAssignsId(2L);

        long newId = cardService.saveCard(1L, 10L, 8L, lessons);

        assertThat(newId).isEqualTo(2L);
        assertThat(previous.isCurrent()).isFalse();

        ArgumentCaptor<List<ConflictDetector.CardLessons>> batch = ArgumentCaptor.forClass(List.class);
        InOrder inOrder = inOrder(cardRepository, lessonEntryRepository, conflictDetector);
        inOrder.verify(cardRepository).saveAndFlush(previous);
        inOrder.verify(lessonEntryRepository).releaseByCardId(1L);
        inOrder.verify(conflictDetector).checkAndInsert(eq(VERSION), batch.capture(), eq(ConflictDetector.Mode.ALL_OR_NOTHING));

        CardEntity next = batch.getValue().get(0).card();
        assertThat(next.getId()).isEqualTo(2L);
        assertThat(next.getStatus()).isEqualTo(CardStatus.edited);
        assertThat(next.isCurrent()).isTrue();
        assertThat(next.getGroupId()).isEqualTo(2L);
        assertThat(next.getCreatedBy()).isEqualTo(8L);
        assertThat(batch.getValue().get(0).lessons()).isEqualTo(lessons);
        verify(versionLookup).touch(10L);
    }

    @Test
    void saveCard_rejectedOnCommittedVersion() {
        when(versionLookup.requireEditable(10L)).thenThrow(new VersionImmutableException(10L));

        assertThatThrownBy(() -> cardService.saveCard(1L, 10L, 8L, List.of()))
                .isInstanceOf(VersionImmutableException.class);

        verifyNoInteractions(cardRepository, conflictDetector);
    }

    @Test
    void saveCard_rejectsHistoricalCard() {
        when(versionLookup.requireEditable(10L)).thenReturn(VERSION);
        when(cardRepository.findById(1L)).thenReturn(Optional.of(card(1L, 2L, CardStatus.edited, false)));

        assertThatThrownBy(() -> cardService.saveCard(1L, 10L, 8L, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not current");
    }

    @Test
    void saveCard_rejectsCardOfAnotherVersion() {
        CardEntity foreign = card(1L, 2L, CardStatus.edited, true);
        foreign.setScheduleVersionId(11L);
        when(versionLookup.requireEditable(10L)).thenReturn(VERSION);
        when(cardRepository.findById(1L)).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> cardService.saveCard(1L, 10L, 8L, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void saveCard_propagatesDoubleBooking() {
        CardEntity previous = card(1L, 2L, CardStatus.draft, true);
        when(versionLookup.requireEditable(10L)).thenReturn(VERSION);
        when(cardRepository.findById(1L)).thenReturn(Optional.of(previous));
        when(cardRepository.findByScheduleVersionIdAndGroupIdAndCurrentTrue(10L, 2L)).thenReturn(Optional.of(previous));
        stubSaveAssignsId(2L);
        when(conflictDetector.checkAndInsert(any(), anyList(), any()))
                .thenThrow(new TeacherDoubleBookedException(10L, List.of(new SlotConflict(null, 1, 5L, "Ivanov", 3L, "IS-22"))));

        assertThatThrownBy(() -> cardService.saveCard(1L, 10L, 8L, List.of(new LessonPayload(null, 1, 100L, 5L, null, false))))
                .isInstanceOf(TeacherDoubleBookedException.class);

        verify(versionLookup, never()).touch(anyLong());
    }

    @Test
    void acceptCard_rejectsCardThatIsAlreadyAccepted() {
        CardEntity card = card(1L, 2L, CardStatus.accepted, true);
        when(cardRepository.findById(1L)).thenReturn(Optional.of(card));
        when(cardRepository.findFirstByScheduleVersionIdAndGroupIdAndStatus(10L, 2L, CardStatus.accepted))
                .thenReturn(Optional.of(card));

        assertThatThrownBy(() -> cardService.acceptCard(1L))
                .isInstanceOf(DuplicateAcceptedException.class);
    }

    @Test
    void acceptCard_checksDuplicateBeforeVersionState() {
        CardEntity card = card(4L, 2L, CardStatus.edited, true);
        when(cardRepository.findById(4L)).thenReturn(Optional.of(card));
        when(cardRepository.findFirstByScheduleVersionIdAndGroupIdAndStatus(10L, 2L, CardStatus.accepted))
                .thenReturn(Optional.of(card(3L, 2L, CardStatus.accepted, false)));

        assertThatThrownBy(() -> cardService.acceptCard(4L))
                .isInstanceOf(DuplicateAcceptedException.class)
                .satisfies(ex -> assertThat(((DuplicateAcceptedException) ex).getAcceptedCardId()).isEqualTo(3L));

        verifyNoInteractions(versionLookup);
    }

    @Test
    void acceptCard_rejectsHistoricalCard() {
        CardEntity historical = card(1L, 2L, CardStatus.edited, false);
        when(cardRepository.findById(1L)).thenReturn(Optional.of(historical));
        when(cardRepository.findFirstByScheduleVersionIdAndGroupIdAndStatus(10L, 2L, CardStatus.accepted))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> cardService.acceptCard(1L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not current");

        assertThat(historical.getStatus()).isEqualTo(CardStatus.edited);
        verify(cardRepository, never()).save(any(CardEntity.class));
        verifyNoInteractions(versionLookup);
    }

    @Test
    void acceptCard_requiresMinimumLessons() {
        CardEntity card = card(1L, 2L, CardStatus.edited, true);
        when(cardRepository.findById(1L)).thenReturn(Optional.of(card));
        when(cardRepository.findFirstByScheduleVersionIdAndGroupIdAndStatus(10L, 2L, CardStatus.accepted))
                .thenReturn(Optional.empty());
        when(versionLookup.requireEditable(10L)).thenReturn(VERSION);
        when(lessonEntryRepository.countByCardId(1L)).thenReturn(1L);

        assertThatThrownBy(() -> cardService.acceptCard(1L))
                .isInstanceOf(InsufficientLessonsException.class)
                .satisfies(ex -> {
                    InsufficientLessonsException e = (InsufficientLessonsException) ex;
                    assertThat(e.getRequired()).isEqualTo(2);
                    assertThat(e.getActual()).isEqualTo(1L);
                });
        assertThat(card.getStatus()).isEqualTo(CardStatus.edited);
    }

    @Test
    void acceptCard_marksCardAccepted() {
        CardEntity card = card(1L, 2L, CardStatus.edited, true);
        when(cardRepository.findById(1L)).thenReturn(Optional.of(card));
        when(cardRepository.findFirstByScheduleVersionIdAndGroupIdAndStatus(10L, 2L, CardStatus.accepted))
                .thenReturn(Optional.empty());
        when(versionLookup.requireEditable(10L)).thenReturn(VERSION);
        when(lessonEntryRepository.countByCardId(1L)).thenReturn(3L);

        cardService.acceptCard(1L);

        assertThat(card.getStatus()).isEqualTo(CardStatus.accepted);
        verify(cardRepository).save(card);
    }

    @Test
    void switchAsEdit_resetsStatusWithoutConflictChecks() {
        CardEntity card = card(1L, 2L, CardStatus.accepted, true);
        when(cardRepository.findById(1L)).thenReturn(Optional.of(card));
        when(versionLookup.requireEditable(10L)).thenReturn(VERSION);

        cardService.switchAsEdit(1L);

        assertThat(card.getStatus()).isEqualTo(CardStatus.edited);
        verifyNoInteractions(conflictDetector);
    }

    @Test
    void switchAsEdit_forbiddenOnCommittedVersion() {
        CardEntity card = card(1L, 2L, CardStatus.accepted, true);
        when(cardRepository.findById(1L)).thenReturn(Optional.of(card));
        when(versionLookup.requireEditable(10L)).thenThrow(new VersionImmutableException(10L));

        assertThatThrownBy(() -> cardService.switchAsEdit(1L))
                .isInstanceOf(VersionImmutableException.class);
        assertThat(card.getStatus()).isEqualTo(CardStatus.accepted);
    }

    @Test
    void history_isCappedAndCarriesAuthorNames() {
        CardEntity current = card(3L, 2L, CardStatus.edited, true);
        CardEntity old = card(1L, 2L, CardStatus.draft, false);
        old.setCreatedBy(9L);
        when(cardRepository.findByScheduleVersionIdAndGroupIdOrderByCurrentDescIdDesc(eq(10L), eq(2L), any(Pageable.class)))
                .thenReturn(List.of(current, old));
        when(referenceDataProvider.userNames(anyCollection())).thenReturn(Map.of(7L, "Petrova", 9L, "Sidorov"));

        List<CardSummaryDTO> history = cardService.history(10L, 2L);

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(cardRepository).findByScheduleVersionIdAndGroupIdOrderByCurrentDescIdDesc(eq(10L), eq(2L), pageable.capture());
        assertThat(pageable.getValue().getPageSize()).isEqualTo(50);

        assertThat(history).extracting(CardSummaryDTO::cardId).containsExactly(3L, 1L);
        assertThat(history).extracting(CardSummaryDTO::userName).containsExactly("Petrova", "Sidorov");
        assertThat(history.get(0).isCurrent()).isTrue();
    }

    @Test
    void content_unknownCardIsNotFound() {
        when(cardRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> cardService.content(99L))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void openNextCard_withoutPreviousCardCreatesFirstState() {
        when(cardRepository.findByScheduleVersionIdAndGroupIdAndCurrentTrue(10L, 2L)).thenReturn(Optional.empty());
        stubSaveAssignsId(5L);

        CardEntity created = cardService.openNextCard(VERSION, 2L, 7L, CardStatus.draft);

        assertThat(created.getId()).isEqualTo(5L);
        assertThat(created.getStatus()).isEqualTo(CardStatus.draft);
        verify(lessonEntryRepository, never()).releaseByCardId(anyLong());
    }

    @Test
    void openNextCard_concurrentReplacementIsReportedAsConflict() {
        CardEntity previous = card(1L, 2L, CardStatus.draft, true);
        when(cardRepository.findByScheduleVersionIdAndGroupIdAndCurrentTrue(10L, 2L)).thenReturn(Optional.of(previous));
        ConstraintViolationException cause = new ConstraintViolationException(
                "duplicate key", new SQLException("duplicate key", "23505"), CardService.CURRENT_CARD_INDEX);
        when(cardRepository.saveAndFlush(any(CardEntity.class))).thenAnswer(inv -> {
            CardEntity c = inv.getArgument(0);
            if (c.getId() == null) {
                throw new DataIntegrityViolationException("duplicate key", cause);
            }
            return c;
        });

        assertThatThrownBy(() -> cardService.openNextCard(VERSION, 2L, 7L, CardStatus.edited))
                .isInstanceOf(CardReplacedConcurrentlyException.class)
                .satisfies(ex -> {
                    CardReplacedConcurrentlyException e = (CardReplacedConcurrentlyException) ex;
                    assertThat(e.getKind()).isEqualTo(ErrorKind.conflict);
                    assertThat(e.getGroupId()).isEqualTo(2L);
                    assertThat(e.getVersionId()).isEqualTo(10L);
                });
    }

    @Test
    void openNextCard_rethrowsUnrelatedIntegrityViolation() {
        when(cardRepository.findByScheduleVersionIdAndGroupIdAndCurrentTrue(10L, 2L)).thenReturn(Optional.empty());
        DataIntegrityViolationException fk = new DataIntegrityViolationException("fk_cards_group");
        when(cardRepository.saveAndFlush(any(CardEntity.class))).thenThrow(fk);

        assertThatThrownBy(() -> cardService.openNextCard(VERSION, 2L, 7L, CardStatus.draft))
                .isSameAs(fk);
    }
}
