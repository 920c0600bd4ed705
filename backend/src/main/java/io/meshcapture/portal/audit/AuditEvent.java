package io.meshcapture.portal.audit;

import io.meshcapture.portal.lifecycle.PortalRole;
import io.meshcapture.portal.lifecycle.ProjectState;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Immutable state-change event persisted to the {@code project_audit_events} table. Once created,
 * rows cannot be updated or deleted (enforced by a database trigger). No {@code @Version}, no
 * {@code updatedAt}, no setters.
 *
 * @see AuditEventRecord
 */
@Entity
@Table(name = "project_audit_events")
public class AuditEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, length = 64, updatable = false)
  private String projectId;

  @Column(name = "user_id", nullable = false, length = 255, updatable = false)
  private String userId;

  @Convert(converter = PortalRoleConverter.class)
  @Column(name = "user_role", nullable = false, length = 30, updatable = false)
  private PortalRole userRole;

  @Enumerated(EnumType.STRING)
  @Column(name = "from_state", nullable = false, length = 20, updatable = false)
  private ProjectState fromState;

  @Enumerated(EnumType.STRING)
  @Column(name = "to_state", nullable = false, length = 20, updatable = false)
  private ProjectState toState;

  @Column(name = "reason", columnDefinition = "TEXT", updatable = false)
  private String reason;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", columnDefinition = "jsonb", updatable = false)
  private Map<String, Object> metadata;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  /** Protected no-arg constructor required by JPA. */
  protected AuditEvent() {}

  /** Creates an event from the given record, keeping the record's timestamp. */
  public AuditEvent(AuditEventRecord record) {
    this.projectId = record.projectId();
    this.userId = record.userId();
    this.userRole = record.userRole();
    this.fromState = record.fromState();
    this.toState = record.toState();
    this.reason = record.reason();
    this.metadata = record.metadata();
    this.occurredAt = record.timestamp();
  }

  public UUID getId() {
    return id;
  }

  public String getProjectId() {
    return projectId;
  }

  public String getUserId() {
    return userId;
  }

  public PortalRole getUserRole() {
    return userRole;
  }

  public ProjectState getFromState() {
    return fromState;
  }

  public ProjectState getToState() {
    return toState;
  }

  public String getReason() {
    return reason;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }

  /** Converts back to the in-process record form. */
  public AuditEventRecord toRecord() {
    return new AuditEventRecord(
        projectId, userId, userRole, fromState, toState, reason, metadata, occurredAt);
  }
}
