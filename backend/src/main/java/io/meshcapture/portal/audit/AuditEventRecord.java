package io.meshcapture.portal.audit;

import io.meshcapture.portal.lifecycle.PortalRole;
import io.meshcapture.portal.lifecycle.ProjectState;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable record of one committed state transition. Constructed by {@link AuditEventBuilder} and
 * handed to {@link AuditService#log(AuditEventRecord)} for append-only storage.
 *
 * @param projectId the project that moved
 * @param userId subject of the acting user
 * @param userRole role the user acted under
 * @param fromState state before the transition
 * @param toState state after the transition
 * @param reason free-text justification; nullable
 * @param metadata free-form key/value context; never null
 * @param timestamp instant the record was built; strictly increasing across records built in this
 *     process
 */
public record AuditEventRecord(
    String projectId,
    String userId,
    PortalRole userRole,
    ProjectState fromState,
    ProjectState toState,
    String reason,
    Map<String, Object> metadata,
    Instant timestamp) {

  public AuditEventRecord {
    metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
