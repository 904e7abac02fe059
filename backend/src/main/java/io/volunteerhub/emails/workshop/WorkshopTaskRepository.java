package io.volunteerhub.emails.workshop;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkshopTaskRepository extends JpaRepository<WorkshopTask, UUID> {

  @Query(
      """
      SELECT t FROM WorkshopTask t
      WHERE t.workshopId = :workshopId AND t.role = :role
      ORDER BY t.createdAt ASC
      """)
  List<WorkshopTask> findByWorkshopIdAndRole(
      @Param("workshopId") UUID workshopId, @Param("role") TaskRole role);

  @Query("SELECT t FROM WorkshopTask t WHERE t.personId = :personId ORDER BY t.createdAt ASC")
  List<WorkshopTask> findByPersonId(@Param("personId") UUID personId);

  @Query("SELECT t FROM WorkshopTask t WHERE t.workshopId = :workshopId ORDER BY t.createdAt ASC")
  List<WorkshopTask> findByWorkshopId(@Param("workshopId") UUID workshopId);
}
