package io.volunteerhub.emails.scheduledemail;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScheduledEmailLogRepository extends JpaRepository<ScheduledEmailLog, UUID> {

  @Query(
      """
      SELECT l FROM ScheduledEmailLog l
      WHERE l.scheduledEmailId = :scheduledEmailId
      ORDER BY l.createdAt ASC, l.id ASC
      """)
  List<ScheduledEmailLog> findByScheduledEmailId(@Param("scheduledEmailId") UUID scheduledEmailId);
}
