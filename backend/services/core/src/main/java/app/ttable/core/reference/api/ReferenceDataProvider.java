package app.ttable.core.reference.api;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the reference data (groups, teachers, disciplines) maintained outside the engine.
 * Only active rows are returned: deactivated entities are invisible to projection and commit checks.
 */
public interface ReferenceDataProvider {

    record GroupRef(long id, String name) {}

    record TeacherRef(long id, String fio) {}

    record DisciplineRef(long id, String title) {}

    List<GroupRef> activeGroups(long buildingId);

    List<TeacherRef> activeTeachers();

    List<DisciplineRef> activeDisciplines();

    // имена авторов для истории карточек, неизвестные id в ответ не попадают
    Map<Long, String> userNames(Collection<Long> userIds);
}
