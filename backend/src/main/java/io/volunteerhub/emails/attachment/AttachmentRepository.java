package io.volunteerhub.emails.attachment;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AttachmentRepository extends JpaRepository<Attachment, UUID> {

  @Query(
      """
      SELECT a FROM Attachment a
      WHERE a.scheduledEmailId = :scheduledEmailId
      ORDER BY a.createdAt ASC
      """)
  List<Attachment> findByScheduledEmailId(@Param("scheduledEmailId") UUID scheduledEmailId);
}
