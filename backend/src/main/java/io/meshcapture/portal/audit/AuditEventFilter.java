package io.meshcapture.portal.audit;

import io.meshcapture.portal.lifecycle.ProjectState;
import java.time.Instant;

/**
 * Query filter record for {@link AuditService#findEvents}. All fields are nullable -- null means
 * "no filter on this field".
 *
 * @param projectId filter by project
 * @param userId filter by acting user
 * @param toState filter by the state the project moved into
 * @param from start of time range (inclusive)
 * @param to end of time range (exclusive)
 */
public record AuditEventFilter(
    String projectId, String userId, ProjectState toState, Instant from, Instant to) {}
