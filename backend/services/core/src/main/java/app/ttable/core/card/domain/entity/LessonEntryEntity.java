package app.ttable.core.card.domain.entity;

import jakarta.persistence.*;

@Entity
@Table(name = "lesson_entries", schema = "ttable")
public class LessonEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "card_id", nullable = false, updatable = false)
    private Long cardId;

    // дублируем версию карточки, чтобы индекс занятости работал без join
    @Column(name = "schedule_version_id", nullable = false, updatable = false)
    private Long scheduleVersionId;

    @Column(name = "week_day")
    private Integer weekDay; // 1..6 только для стандартного расписания

    @Column(name = "position", nullable = false)
    private int position;

    @Column(name = "discipline_id", nullable = false)
    private Long disciplineId;

    @Column(name = "teacher_id", nullable = false)
    private Long teacherId;

    @Column(name = "room")
    private String room;

    @Column(name = "is_force", nullable = false)
    private boolean force;

    @Column(name = "is_current", nullable = false)
    private boolean current;

    public LessonEntryEntity() {
    }

    public LessonEntryEntity(Long cardId,
                             Long scheduleVersionId,
                             Integer weekDay,
                             int position,
                             Long disciplineId,
                             Long teacherId,
                             String room,
                             boolean force,
                             boolean current) {
        this.cardId = cardId;
        this.scheduleVersionId = scheduleVersionId;
        this.weekDay = weekDay;
        this.position = position;
        this.disciplineId = disciplineId;
        this.teacherId = teacherId;
        this.room = room;
        this.force = force;
        this.current = current;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getCardId() {
        return cardId;
    }

    public void setCardId(Long cardId) {
        this.cardId = cardId;
    }

    public Long getScheduleVersionId() {
        return scheduleVersionId;
    }

    public void setScheduleVersionId(Long scheduleVersionId) {
        this.scheduleVersionId = scheduleVersionId;
    }

    public Integer getWeekDay() {
        return weekDay;
    }

    public void setWeekDay(Integer weekDay) {
        this.weekDay = weekDay;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public Long getDisciplineId() {
        return disciplineId;
    }

    public void setDisciplineId(Long disciplineId) {
        this.disciplineId = disciplineId;
    }

    public Long getTeacherId() {
        return teacherId;
    }

    public void setTeacherId(Long teacherId) {
        this.teacherId = teacherId;
    }

    public String getRoom() {
        return room;
    }

    public void setRoom(String room) {
        this.room = room;
    }

    public boolean isForce() {
        return force;
    }

    public void setForce(boolean force) {
        this.force = force;
    }

    public boolean isCurrent() {
        return current;
    }

    public void setCurrent(boolean current) {
        this.current = current;
    }
}
