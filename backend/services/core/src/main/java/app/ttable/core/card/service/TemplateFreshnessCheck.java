package app.ttable.core.card.service;

import app.ttable.core.card.api.VersionLookupPort;
import app.ttable.core.card.domain.dto.TemplateFreshnessDTO;
import app.ttable.core.card.repository.CardRepository;
import app.ttable.core.card.repository.LessonEntryRepository;
import app.ttable.core.common.error.NotFoundException;
import app.ttable.core.reference.api.ReferenceDataProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

// Что из действующего стандартного расписания ссылается на неактивные группы/преподавателей/дисциплины
@Service
public class TemplateFreshnessCheck {

    private final CardRepository cardRepository;
    private final LessonEntryRepository lessonEntryRepository;
    private final VersionLookupPort versionLookup;
    private final ReferenceDataProvider referenceDataProvider;

    public TemplateFreshnessCheck(CardRepository cardRepository,
                                  LessonEntryRepository lessonEntryRepository,
                                  VersionLookupPort versionLookup,
                                  ReferenceDataProvider referenceDataProvider) {
        this.cardRepository = cardRepository;
        this.lessonEntryRepository = lessonEntryRepository;
        this.versionLookup = versionLookup;
        this.referenceDataProvider = referenceDataProvider;
    }

    @Transactional(readOnly = true)
    public TemplateFreshnessDTO check(long buildingId) {
        long standardId = versionLookup.findCommittedStandard(buildingId)
                .orElseThrow(() -> new NotFoundException("Committed standard version for building", buildingId));

        Set<Long> activeGroups = referenceDataProvider.activeGroups(buildingId).stream()
                .map(ReferenceDataProvider.GroupRef::id)
                .collect(Collectors.toSet());
        Set<Long> activeTeachers = referenceDataProvider.activeTeachers().stream()
                .map(ReferenceDataProvider.TeacherRef::id)
                .collect(Collectors.toSet());
        Set<Long> activeDisciplines = referenceDataProvider.activeDisciplines().stream()
                .map(ReferenceDataProvider.DisciplineRef::id)
                .collect(Collectors.toSet());

        return new TemplateFreshnessDTO(
                standardId,
                inactive(cardRepository.findCurrentGroupIds(standardId), activeGroups),
                inactive(lessonEntryRepository.findCurrentTeacherIds(standardId), activeTeachers),
                inactive(lessonEntryRepository.findCurrentDisciplineIds(standardId), activeDisciplines)
        );
    }

    private static List<Long> inactive(Collection<Long> referenced, Set<Long> active) {
        return referenced.stream()
                .filter(id -> !active.contains(id))
                .distinct()
                .sorted()
                .toList();
    }
}
