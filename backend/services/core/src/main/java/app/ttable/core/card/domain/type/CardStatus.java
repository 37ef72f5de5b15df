package app.ttable.core.card.domain.type;

public enum CardStatus {
    draft,
    edited,
    accepted
}
