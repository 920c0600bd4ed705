package io.meshcapture.portal.audit;

import io.meshcapture.portal.lifecycle.ProjectState;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  /** Full transition history of a project, oldest first. */
  List<AuditEvent> findByProjectIdOrderByOccurredAtAsc(String projectId);

  /**
   * Multi-parameter JPQL query with nullable filters. Each parameter uses the nullable pattern:
   * {@code (:param IS NULL OR e.field = :param)}. Results ordered by occurredAt DESC.
   */
  @Query(
      """
      SELECT e FROM AuditEvent e
      WHERE (CAST(:projectId AS string) IS NULL OR e.projectId = :projectId)
        AND (CAST(:userId AS string) IS NULL OR e.userId = :userId)
        AND (:toState IS NULL OR e.toState = :toState)
        AND (CAST(:from AS timestamp) IS NULL OR e.occurredAt >= :from)
        AND (CAST(:to AS timestamp) IS NULL OR e.occurredAt < :to)
      ORDER BY e.occurredAt DESC
      """)
  Page<AuditEvent> findByFilter(
      @Param("projectId") String projectId,
      @Param("userId") String userId,
      @Param("toState") ProjectState toState,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);
}
