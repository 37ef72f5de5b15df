package app.ttable.core.version.domain.type;

public enum TimetableKind {
    standard,
    replacements
}
