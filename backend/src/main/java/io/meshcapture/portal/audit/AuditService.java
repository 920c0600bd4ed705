package io.meshcapture.portal.audit;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/** Service interface for appending and querying project state-change events. */
public interface AuditService {

  /**
   * Appends a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   *
   * @param record the event to persist
   */
  void log(AuditEventRecord record);

  /**
   * Returns the transition history of one project ordered by timestamp, oldest first.
   *
   * @param projectId the project whose history to load
   */
  List<AuditEvent> findByProject(String projectId);

  /** Looks up a single event by its id. */
  Optional<AuditEvent> findEvent(UUID id);

  /**
   * Queries audit events matching the given filter. All filter fields are optional.
   *
   * @return a page of matching events ordered by occurredAt DESC
   */
  Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable);

  /**
   * Loads the events matching the filter for export, newest first, capped at {@code
   * portal.audit.max-export-rows}.
   */
  List<AuditEvent> exportEvents(AuditEventFilter filter);
}
