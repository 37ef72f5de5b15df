package app.ttable.core.card.adapter;

import app.ttable.core.card.api.CardCoveragePort;
import app.ttable.core.card.domain.type.CardStatus;
import app.ttable.core.card.repository.CardRepository;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class CardCoverageAdapter implements CardCoveragePort {

    // отредактированная, но не утверждённая карточка группу не закрывает
    private static final List<CardStatus> COVERING = List.of(CardStatus.accepted, CardStatus.draft);

    private final CardRepository cardRepository;

    public CardCoverageAdapter(CardRepository cardRepository) {
        this.cardRepository = cardRepository;
    }

    @Override
    public Set<Long> coveredGroupIds(long versionId) {
        return new HashSet<>(cardRepository.findCurrentGroupIdsWithStatus(versionId, COVERING));
    }
}
