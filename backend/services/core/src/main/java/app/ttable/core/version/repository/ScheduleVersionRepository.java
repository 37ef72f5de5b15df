package app.ttable.core.version.repository;

import app.ttable.core.version.domain.entity.ScheduleVersionEntity;
import app.ttable.core.version.domain.type.TimetableKind;
import app.ttable.core.version.domain.type.VersionStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface ScheduleVersionRepository extends JpaRepository<ScheduleVersionEntity, Long> {

    Optional<ScheduleVersionEntity> findByIdAndBuildingId(Long id, Long buildingId);

    Optional<ScheduleVersionEntity> findFirstByBuildingIdAndKindAndCommittedTrue(Long buildingId, TimetableKind kind);

    List<ScheduleVersionEntity> findByBuildingIdAndKindAndCommittedTrueAndIdNot(Long buildingId,
                                                                                TimetableKind kind,
                                                                                Long id);

    @Query("""
            select v from ScheduleVersionEntity v
            where v.buildingId = :buildingId
              and (:status is null or v.status = :status)
              and (:kind is null or v.kind = :kind)
              and (:committed is null or v.committed = :committed)
              and (:scheduleDate is null or v.scheduleDate = :scheduleDate)
            """)
    Page<ScheduleVersionEntity> search(@Param("buildingId") Long buildingId,
                                       @Param("status") VersionStatus status,
                                       @Param("kind") TimetableKind kind,
                                       @Param("committed") Boolean committed,
                                       @Param("scheduleDate") LocalDate scheduleDate,
                                       Pageable pageable);
}
