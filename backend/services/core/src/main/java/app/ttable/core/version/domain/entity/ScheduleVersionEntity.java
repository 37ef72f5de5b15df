package app.ttable.core.version.domain.entity;

import app.ttable.core.version.domain.type.TimetableKind;
import app.ttable.core.version.domain.type.VersionStatus;
import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "schedule_versions", schema = "ttable")
public class ScheduleVersionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "building_id", nullable = false, updatable = false)
    private Long buildingId;

    @Column(name = "schedule_date")
    private LocalDate scheduleDate; // NULL для стандартного расписания

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, updatable = false)
    private TimetableKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private VersionStatus status;

    @Column(name = "is_committed", nullable = false)
    private boolean committed;

    @Column(name = "created_by", nullable = false, updatable = false)
    private Long createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_modified_at")
    private Instant lastModifiedAt;

    public ScheduleVersionEntity() {
    }

    public ScheduleVersionEntity(Long buildingId,
                                 LocalDate scheduleDate,
                                 TimetableKind kind,
                                 VersionStatus status,
                                 boolean committed,
                                 Long createdBy,
                                 Instant createdAt,
                                 Instant lastModifiedAt) {
        this.buildingId = buildingId;
        this.scheduleDate = scheduleDate;
        this.kind = kind;
        this.status = status;
        this.committed = committed;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
        this.lastModifiedAt = lastModifiedAt;
    }

    /**
     * A version stays editable until it is both committed and accepted.
     */
    public boolean isEditable() {
        return !committed || status != VersionStatus.accepted;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getBuildingId() {
        return buildingId;
    }

    public void setBuildingId(Long buildingId) {
        this.buildingId = buildingId;
    }

    public LocalDate getScheduleDate() {
        return scheduleDate;
    }

    public void setScheduleDate(LocalDate scheduleDate) {
        this.scheduleDate = scheduleDate;
    }

    public TimetableKind getKind() {
        return kind;
    }

    public void setKind(TimetableKind kind) {
        this.kind = kind;
    }

    public VersionStatus getStatus() {
        return status;
    }

    public void setStatus(VersionStatus status) {
        this.status = status;
    }

    public boolean isCommitted() {
        return committed;
    }

    public void setCommitted(boolean committed) {
        this.committed = committed;
    }

    public Long getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(Long createdBy) {
        this.createdBy = createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastModifiedAt() {
        return lastModifiedAt;
    }

    public void setLastModifiedAt(Instant lastModifiedAt) {
        this.lastModifiedAt = lastModifiedAt;
    }
}
