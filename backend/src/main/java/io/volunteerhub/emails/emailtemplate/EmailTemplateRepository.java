package io.volunteerhub.emails.emailtemplate;

import io.volunteerhub.emails.trigger.TriggerKind;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EmailTemplateRepository extends JpaRepository<EmailTemplate, UUID> {

  @Query("SELECT t FROM EmailTemplate t WHERE t.triggerKind = :triggerKind AND t.active = true")
  Optional<EmailTemplate> findActiveByTriggerKind(@Param("triggerKind") TriggerKind triggerKind);

  @Query("SELECT t FROM EmailTemplate t WHERE t.triggerKind = :triggerKind")
  Optional<EmailTemplate> findByTriggerKind(@Param("triggerKind") TriggerKind triggerKind);
}
