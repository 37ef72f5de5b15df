package app.ttable.core.reference.adapter;

import app.ttable.core.reference.api.ReferenceDataProvider;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class JdbcReferenceDataProvider implements ReferenceDataProvider {

    private final JdbcTemplate jdbcTemplate;

    public JdbcReferenceDataProvider(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<GroupRef> activeGroups(long buildingId) {
        return jdbcTemplate.query(
                """
                select g.id, g.name
                from ttable.groups g
                where g.building_id = ?
                  and g.is_active = true
                order by g.name
                """,
                (rs, rowNum) -> new GroupRef(rs.getLong("id"), rs.getString("name")),
                buildingId
        );
    }

    @Override
    public List<TeacherRef> activeTeachers() {
        return jdbcTemplate.query(
                """
                select t.id, t.fio
                from ttable.teachers t
                where t.is_active = true
                order by t.fio
                """,
                (rs, rowNum) -> new TeacherRef(rs.getLong("id"), rs.getString("fio"))
        );
    }

    @Override
    public List<DisciplineRef> activeDisciplines() {
        return jdbcTemplate.query(
                """
                select d.id, d.title
                from ttable.disciplines d
                where d.is_active = true
                order by d.title
                """,
                (rs, rowNum) -> new DisciplineRef(rs.getLong("id"), rs.getString("title"))
        );
    }

    @Override
    public Map<Long, String> userNames(Collection<Long> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return Map.of();
        }
        Map<Long, String> names = new HashMap<>();
        jdbcTemplate.query(
                """
                select u.id, u.name
                from ttable.users u
                where u.id = any(?)
                """,
                rs -> {
                    names.put(rs.getLong("id"), rs.getString("name"));
                },
                (Object) userIds.toArray(new Long[0])
        );
        return names;
    }
}
