package app.ttable.core.version.domain.type;

public enum VersionStatus {
    accepted,
    pending
}
