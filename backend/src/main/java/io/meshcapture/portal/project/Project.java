package io.meshcapture.portal.project;

import io.meshcapture.portal.lifecycle.ProjectState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "projects")
public class Project {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "customer_id", length = 255)
  private String customerId;

  @Enumerated(EnumType.STRING)
  @Column(name = "state", nullable = false, length = 20)
  private ProjectState state;

  @Column(name = "created_by", nullable = false, length = 255)
  private String createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "state_changed_at", nullable = false)
  private Instant stateChangedAt;

  @Version
  @Column(name = "version", nullable = false)
  private Long version;

  protected Project() {}

  public Project(String name, String description, String customerId, String createdBy) {
    this.name = name;
    this.description = description;
    this.customerId = customerId;
    this.createdBy = createdBy;
    this.state = ProjectState.REQUESTED;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
    this.stateChangedAt = this.createdAt;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public String getCustomerId() {
    return customerId;
  }

  public ProjectState getState() {
    return state;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getStateChangedAt() {
    return stateChangedAt;
  }

  public Long getVersion() {
    return version;
  }

  /**
   * Moves the project to {@code target}. Callers must have validated the move first; this method
   * only records it.
   */
  void applyTransition(ProjectState target) {
    Objects.requireNonNull(target, "target");
    this.state = target;
    this.stateChangedAt = Instant.now();
    this.updatedAt = this.stateChangedAt;
  }
}
