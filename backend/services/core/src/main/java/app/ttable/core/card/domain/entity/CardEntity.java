package app.ttable.core.card.domain.entity;

import app.ttable.core.card.domain.type.CardStatus;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "cards", schema = "ttable")
public class CardEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "schedule_version_id", nullable = false, updatable = false)
    private Long scheduleVersionId;

    @Column(name = "group_id", nullable = false, updatable = false)
    private Long groupId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private CardStatus status;

    @Column(name = "is_current", nullable = false)
    private boolean current;

    @Column(name = "created_by", nullable = false, updatable = false)
    private Long createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public CardEntity() {
    }

    public CardEntity(Long scheduleVersionId,
                      Long groupId,
                      CardStatus status,
                      boolean current,
                      Long createdBy,
                      Instant createdAt) {
        this.scheduleVersionId = scheduleVersionId;
        this.groupId = groupId;
        this.status = status;
        this.current = current;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getScheduleVersionId() {
        return scheduleVersionId;
    }

    public void setScheduleVersionId(Long scheduleVersionId) {
        this.scheduleVersionId = scheduleVersionId;
    }

    public Long getGroupId() {
        return groupId;
    }

    public void setGroupId(Long groupId) {
        this.groupId = groupId;
    }

    public CardStatus getStatus() {
        return status;
    }

    public void setStatus(CardStatus status) {
        this.status = status;
    }

    public boolean isCurrent() {
        return current;
    }

    public void setCurrent(boolean current) {
        this.current = current;
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
}
