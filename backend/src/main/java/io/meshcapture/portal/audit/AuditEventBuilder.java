package io.meshcapture.portal.audit;

import io.meshcapture.portal.lifecycle.PortalRole;
import io.meshcapture.portal.lifecycle.ProjectState;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builder that constructs an {@link AuditEventRecord} for a committed transition. Pure
 * construction: it does not check that the transition was validated, callers build a record only
 * after {@code TransitionValidator.validate} returned a valid decision.
 *
 * <p>Required fields: {@code projectId}, {@code userId}, {@code userRole}, {@code fromState},
 * {@code toState}. The timestamp comes from an {@link AuditTimestampSource}; records built from the
 * same source are strictly ordered. {@link #builder()} uses a shared system-clock source.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder(timestampSource)
 *     .projectId(project.getId().toString())
 *     .userId(actor.userId())
 *     .userRole(actor.role())
 *     .fromState(ProjectState.QA)
 *     .toState(ProjectState.DELIVERED)
 *     .reason("looks good")
 *     .metadata(Map.of("requires_approval", true))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final AuditTimestampSource SYSTEM_UTC = new AuditTimestampSource();

  private final AuditTimestampSource timestampSource;

  private String projectId;
  private String userId;
  private PortalRole userRole;
  private ProjectState fromState;
  private ProjectState toState;
  private String reason;
  private final Map<String, Object> metadata = new LinkedHashMap<>();

  private AuditEventBuilder(AuditTimestampSource timestampSource) {
    this.timestampSource = Objects.requireNonNull(timestampSource, "timestampSource");
  }

  /** Creates a new builder stamping records from the shared system UTC source. */
  public static AuditEventBuilder builder() {
    return new AuditEventBuilder(SYSTEM_UTC);
  }

  /** Creates a new builder stamping records from the given source. */
  public static AuditEventBuilder builder(AuditTimestampSource timestampSource) {
    return new AuditEventBuilder(timestampSource);
  }

  /** Shorthand for the common case of a transition with an optional reason and no metadata. */
  public static AuditEventRecord transition(
      String projectId,
      String userId,
      PortalRole userRole,
      ProjectState fromState,
      ProjectState toState,
      String reason) {
    return builder()
        .projectId(projectId)
        .userId(userId)
        .userRole(userRole)
        .fromState(fromState)
        .toState(toState)
        .reason(reason)
        .build();
  }

  public AuditEventBuilder projectId(String projectId) {
    this.projectId = projectId;
    return this;
  }

  public AuditEventBuilder userId(String userId) {
    this.userId = userId;
    return this;
  }

  public AuditEventBuilder userRole(PortalRole userRole) {
    this.userRole = userRole;
    return this;
  }

  public AuditEventBuilder fromState(ProjectState fromState) {
    this.fromState = fromState;
    return this;
  }

  public AuditEventBuilder toState(ProjectState toState) {
    this.toState = toState;
    return this;
  }

  public AuditEventBuilder reason(String reason) {
    this.reason = reason;
    return this;
  }

  /** Merges the given entries into the record's metadata. Null maps are ignored. */
  public AuditEventBuilder metadata(Map<String, ?> metadata) {
    if (metadata != null) {
      this.metadata.putAll(metadata);
    }
    return this;
  }

  public AuditEventBuilder metadata(String key, Object value) {
    this.metadata.put(key, value);
    return this;
  }

  /**
   * Builds the record.
   *
   * @throws IllegalStateException if a required field is missing
   */
  public AuditEventRecord build() {
    requirePresent(projectId, "projectId");
    requirePresent(userId, "userId");
    requirePresent(userRole, "userRole");
    requirePresent(fromState, "fromState");
    requirePresent(toState, "toState");

    return new AuditEventRecord(
        projectId,
        userId,
        userRole,
        fromState,
        toState,
        reason,
        metadata,
        timestampSource.next());
  }

  private static void requirePresent(Object value, String field) {
    if (value == null || (value instanceof String s && s.isBlank())) {
      throw new IllegalStateException("Audit event is missing required field: " + field);
    }
  }
}
