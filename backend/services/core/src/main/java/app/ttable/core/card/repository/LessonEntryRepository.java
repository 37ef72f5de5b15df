package app.ttable.core.card.repository;

import app.ttable.core.card.domain.entity.LessonEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface LessonEntryRepository extends JpaRepository<LessonEntryEntity, Long> {

    interface OccupiedSlotProjection {
        Integer getWeekDay();

        int getLessonPosition();

        Long getTeacherId();

        Long getGroupId();
    }

    interface TemplateLessonProjection {
        Long getGroupId();

        int getLessonPosition();

        Long getDisciplineId();

        Long getTeacherId();

        String getRoom();

        Boolean getForce();
    }

    interface LessonRowProjection {
        Long getLessonId();

        Long getCardId();

        Integer getWeekDay();

        int getPosition();

        Long getDisciplineId();

        String getDisciplineTitle();

        Long getTeacherId();

        String getTeacherName();

        String getRoom();

        Boolean getForce();
    }

    long countByCardId(Long cardId);

    // Слоты, уже занятые преподавателями в текущих карточках версии (force-пары слот не занимают)
    @Query("""
            select l.weekDay as weekDay,
                   l.position as lessonPosition,
                   l.teacherId as teacherId,
                   c.groupId as groupId
            from LessonEntryEntity l
            join CardEntity c on c.id = l.cardId
            where l.scheduleVersionId = :versionId
              and l.current = true
              and l.force = false
              and l.teacherId in :teacherIds
            """)
    List<OccupiedSlotProjection> findOccupiedSlots(@Param("versionId") Long versionId,
                                                   @Param("teacherIds") Collection<Long> teacherIds);

    @Query("""
            select c.groupId as groupId,
                   l.position as lessonPosition,
                   l.disciplineId as disciplineId,
                   l.teacherId as teacherId,
                   l.room as room,
                   l.force as force
            from LessonEntryEntity l
            join CardEntity c on c.id = l.cardId
            where l.scheduleVersionId = :versionId
              and l.current = true
              and l.weekDay = :weekDay
            order by c.groupId, l.position, l.id
            """)
    List<TemplateLessonProjection> findTemplateLessons(@Param("versionId") Long versionId,
                                                       @Param("weekDay") Integer weekDay);

    @Query(value = """
            select
                l.id as "lessonId",
                l.card_id as "cardId",
                l.week_day as "weekDay",
                l.position as "position",
                l.discipline_id as "disciplineId",
                d.title as "disciplineTitle",
                l.teacher_id as "teacherId",
                t.fio as "teacherName",
                l.room as "room",
                l.is_force as "force"
            from ttable.lesson_entries l
            join ttable.disciplines d on d.id = l.discipline_id
            join ttable.teachers t on t.id = l.teacher_id
            where l.card_id = :cardId
            order by l.week_day nulls first, l.position, l.id
            """, nativeQuery = true)
    List<LessonRowProjection> loadCardLessons(@Param("cardId") Long cardId);

    @Query("""
            select distinct l.teacherId from LessonEntryEntity l
            where l.scheduleVersionId = :versionId
              and l.current = true
            """)
    List<Long> findCurrentTeacherIds(@Param("versionId") Long versionId);

    @Query("""
            select distinct l.disciplineId from LessonEntryEntity l
            where l.scheduleVersionId = :versionId
              and l.current = true
            """)
    List<Long> findCurrentDisciplineIds(@Param("versionId") Long versionId);

    @Modifying(flushAutomatically = true)
    @Query("update LessonEntryEntity l set l.current = false where l.cardId = :cardId")
    int releaseByCardId(@Param("cardId") Long cardId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from LessonEntryEntity l where l.cardId in :cardIds")
    int deleteByCardIdIn(@Param("cardIds") Collection<Long> cardIds);
}
