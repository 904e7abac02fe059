package io.volunteerhub.emails.workshop;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AwardRepository extends JpaRepository<Award, UUID> {

  @Query("SELECT a FROM Award a WHERE a.personId = :personId ORDER BY a.awardedOn ASC")
  List<Award> findByPersonId(@Param("personId") UUID personId);
}
