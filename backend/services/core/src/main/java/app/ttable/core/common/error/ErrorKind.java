package app.ttable.core.common.error;

public enum ErrorKind {
    not_found,
    conflict,
    forbidden,
    validation
}
