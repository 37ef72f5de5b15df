package app.ttable.core.card.repository;

import app.ttable.core.card.domain.entity.CardEntity;
import app.ttable.core.card.domain.type.CardStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CardRepository extends JpaRepository<CardEntity, Long> {

    interface CurrentCardRowProjection {
        Long getCardId();

        String getCardStatus();

        Long getGroupId();

        String getGroupName();

        Long getLessonId();

        Integer getWeekDay();

        Integer getPosition();

        Long getDisciplineId();

        String getDisciplineTitle();

        Long getTeacherId();

        String getTeacherName();

        String getRoom();

        Boolean getForce();
    }

    Optional<CardEntity> findByScheduleVersionIdAndGroupIdAndCurrentTrue(Long scheduleVersionId, Long groupId);

    Optional<CardEntity> findFirstByScheduleVersionIdAndGroupIdAndStatus(Long scheduleVersionId,
                                                                         Long groupId,
                                                                         CardStatus status);

    List<CardEntity> findByIdInAndScheduleVersionId(Collection<Long> ids, Long scheduleVersionId);

    List<CardEntity> findByScheduleVersionIdAndGroupIdOrderByCurrentDescIdDesc(Long scheduleVersionId,
                                                                               Long groupId,
                                                                               Pageable pageable);

    long countByScheduleVersionIdAndGroupId(Long scheduleVersionId, Long groupId);

    @Query("""
            select distinct c.groupId from CardEntity c
            where c.scheduleVersionId = :versionId
              and c.current = true
              and c.status in :statuses
            """)
    List<Long> findCurrentGroupIdsWithStatus(@Param("versionId") Long versionId,
                                             @Param("statuses") Collection<CardStatus> statuses);

    @Query("""
            select distinct c.groupId from CardEntity c
            where c.scheduleVersionId = :versionId
              and c.current = true
            """)
    List<Long> findCurrentGroupIds(@Param("versionId") Long versionId);

    // Все текущие карточки версии вместе с парами и названиями
    @Query(value = """
            select
                c.id as "cardId",
                c.status as "cardStatus",
                c.group_id as "groupId",
                g.name as "groupName",
                l.id as "lessonId",
                l.week_day as "weekDay",
                l.position as "position",
                l.discipline_id as "disciplineId",
                d.title as "disciplineTitle",
                l.teacher_id as "teacherId",
                t.fio as "teacherName",
                l.room as "room",
                l.is_force as "force"
            from ttable.cards c
            join ttable.groups g on g.id = c.group_id
            left join ttable.lesson_entries l on l.card_id = c.id
            left join ttable.disciplines d on d.id = l.discipline_id
            left join ttable.teachers t on t.id = l.teacher_id
            where c.schedule_version_id = :versionId
              and c.is_current = true
            order by g.name, c.id, l.week_day nulls first, l.position, l.id
            """, nativeQuery = true)
    List<CurrentCardRowProjection> loadCurrentCardRows(@Param("versionId") Long versionId);
}
