package io.volunteerhub.emails.workshop;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkshopRepository extends JpaRepository<Workshop, UUID> {

  @Query("SELECT w FROM Workshop w WHERE w.slug = :slug")
  Optional<Workshop> findBySlug(@Param("slug") String slug);
}
