package io.volunteerhub.emails.workshop;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "workshops")
public class Workshop {

  public static final String SELF_ORGANIZED_DOMAIN = "self-organized";
  public static final String COMMUNITY_LESSONS_DOMAIN = "community-lessons";

  /** Tags marking a workshop that will not run as planned. */
  public static final Set<String> INACTIVE_TAGS = Set.of("cancelled", "unresponsive", "stalled");

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "slug", nullable = false, unique = true, length = 100)
  private String slug;

  @Column(name = "venue", length = 255)
  private String venue;

  @Column(name = "start_date")
  private LocalDate startDate;

  @Column(name = "end_date")
  private LocalDate endDate;

  @Column(name = "administrator_domain", length = 255)
  private String administratorDomain;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tags")
  private List<String> tags = new ArrayList<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Workshop() {}

  public Workshop(
      String slug,
      String venue,
      LocalDate startDate,
      LocalDate endDate,
      String administratorDomain,
      List<String> tags) {
    this.slug = slug;
    this.venue = venue;
    this.startDate = startDate;
    this.endDate = endDate;
    this.administratorDomain = administratorDomain;
    this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void reschedule(LocalDate startDate, LocalDate endDate) {
    this.startDate = startDate;
    this.endDate = endDate;
    this.updatedAt = Instant.now();
  }

  public void changeAdministrator(String administratorDomain) {
    this.administratorDomain = administratorDomain;
    this.updatedAt = Instant.now();
  }

  public void replaceTags(List<String> tags) {
    this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    this.updatedAt = Instant.now();
  }

  /** Run by a central administrator rather than by the host institution itself. */
  public boolean isCentrallyOrganised() {
    return administratorDomain != null
        && !administratorDomain.isBlank()
        && !SELF_ORGANIZED_DOMAIN.equals(administratorDomain);
  }

  public boolean hasAdministrator() {
    return administratorDomain != null && !administratorDomain.isBlank();
  }

  public boolean isCommunityLesson() {
    return COMMUNITY_LESSONS_DOMAIN.equals(administratorDomain);
  }

  public boolean isActive() {
    return tags == null || tags.stream().noneMatch(INACTIVE_TAGS::contains);
  }

  public UUID getId() {
    return id;
  }

  public String getSlug() {
    return slug;
  }

  public String getVenue() {
    return venue;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public String getAdministratorDomain() {
    return administratorDomain;
  }

  public List<String> getTags() {
    return tags;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
