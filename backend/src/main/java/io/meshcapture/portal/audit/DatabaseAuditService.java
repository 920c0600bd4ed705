package io.meshcapture.portal.audit;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed implementation of {@link AuditService}. Delegates persistence and querying to
 * {@link AuditEventRepository}.
 *
 * <p>Transaction semantics: {@code log()} participates in the caller's transaction (no
 * REQUIRES_NEW). If the state change rolls back, the audit event rolls back too.
 */
@Service
@EnableConfigurationProperties(AuditProperties.class)
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final AuditProperties auditProperties;

  public DatabaseAuditService(
      AuditEventRepository auditEventRepository, AuditProperties auditProperties) {
    this.auditEventRepository = auditEventRepository;
    this.auditProperties = auditProperties;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    auditEventRepository.save(new AuditEvent(record));
    log.debug(
        "Recorded audit event: project={}, {} -> {}, user={}, role={}",
        record.projectId(),
        record.fromState(),
        record.toState(),
        record.userId(),
        record.userRole());
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEvent> findByProject(String projectId) {
    return auditEventRepository.findByProjectIdOrderByOccurredAtAsc(projectId);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<AuditEvent> findEvent(UUID id) {
    return auditEventRepository.findById(id);
  }

  @Override
  @Transactional(readOnly = true)
  public Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable) {
    return auditEventRepository.findByFilter(
        filter.projectId(),
        filter.userId(),
        filter.toState(),
        filter.from(),
        filter.to(),
        pageable);
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEvent> exportEvents(AuditEventFilter filter) {
    var page = findEvents(filter, PageRequest.of(0, auditProperties.maxExportRows()));
    if (page.hasNext()) {
      log.warn(
          "Audit export truncated to {} of {} matching events",
          page.getNumberOfElements(),
          page.getTotalElements());
    }
    return page.getContent();
  }
}
