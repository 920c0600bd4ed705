package io.meshcapture.portal.audit;

import io.meshcapture.portal.exception.AuditEventNotFoundException;
import io.meshcapture.portal.exception.InvalidRequestException;
import io.meshcapture.portal.exception.RequestParameters;
import io.meshcapture.portal.lifecycle.PortalRole;
import io.meshcapture.portal.project.ProjectService;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuditEventController {

  private final AuditService auditService;
  private final ProjectService projectService;
  private final AuditProperties auditProperties;
  private final AuditEventCsvWriter csvWriter;

  public AuditEventController(
      AuditService auditService,
      ProjectService projectService,
      AuditProperties auditProperties,
      AuditEventCsvWriter csvWriter) {
    this.auditService = auditService;
    this.projectService = projectService;
    this.auditProperties = auditProperties;
    this.csvWriter = csvWriter;
  }

  @GetMapping("/api/projects/{projectId}/audit-events")
  public ResponseEntity<List<AuditEventResponse>> listProjectHistory(
      @PathVariable UUID projectId) {
    // 404 for unknown projects rather than an empty history
    projectService.getProject(projectId);
    var history =
        auditService.findByProject(projectId.toString()).stream()
            .map(AuditEventResponse::from)
            .toList();
    return ResponseEntity.ok(history);
  }

  @GetMapping("/api/audit-events")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Page<AuditEventResponse>> listAuditEvents(
      @RequestParam(required = false) String projectId,
      @RequestParam(required = false) String userId,
      @RequestParam(required = false) String toState,
      @RequestParam(required = false) Instant from,
      @RequestParam(required = false) Instant to,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {

    var filter = filterOf(projectId, userId, toState, from, to);
    var pageable =
        PageRequest.of(
            page,
            Math.min(size, auditProperties.maxPageSize()),
            Sort.by(Sort.Direction.DESC, "occurredAt"));
    var events = auditService.findEvents(filter, pageable);

    return ResponseEntity.ok(events.map(AuditEventResponse::from));
  }

  @GetMapping("/api/audit-events/{eventId}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<AuditEventResponse> getAuditEvent(@PathVariable UUID eventId) {
    var event =
        auditService
            .findEvent(eventId)
            .orElseThrow(() -> new AuditEventNotFoundException(eventId));
    return ResponseEntity.ok(AuditEventResponse.from(event));
  }

  /** Compliance export of the filtered events as a CSV or JSON attachment. */
  @GetMapping("/api/audit-events/export")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<?> exportAuditEvents(
      @RequestParam(defaultValue = "csv") String format,
      @RequestParam(required = false) String projectId,
      @RequestParam(required = false) String userId,
      @RequestParam(required = false) String toState,
      @RequestParam(required = false) Instant from,
      @RequestParam(required = false) Instant to)
      throws IOException {
    var filter = filterOf(projectId, userId, toState, from, to);

    switch (format) {
      case "csv" -> {
        var output = new ByteArrayOutputStream();
        csvWriter.writeCsv(auditService.exportEvents(filter), output);
        return ResponseEntity.ok()
            .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
            .header(HttpHeaders.CONTENT_DISPOSITION, attachment("csv"))
            .body(output.toByteArray());
      }
      case "json" -> {
        var events =
            auditService.exportEvents(filter).stream().map(AuditEventResponse::from).toList();
        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .header(HttpHeaders.CONTENT_DISPOSITION, attachment("json"))
            .body(events);
      }
      default ->
          throw new InvalidRequestException(
              "Parameter 'format' must be csv or json, was: " + format);
    }
  }

  private static AuditEventFilter filterOf(
      String projectId, String userId, String toState, Instant from, Instant to) {
    return new AuditEventFilter(
        projectId, userId, RequestParameters.optionalState("toState", toState), from, to);
  }

  private static String attachment(String extension) {
    return "attachment; filename=\"project-audit-events." + extension + "\"";
  }

  // --- DTO ---

  public record AuditEventResponse(
      UUID id,
      String projectId,
      String userId,
      String userRole,
      String fromState,
      String toState,
      String reason,
      Map<String, Object> metadata,
      Instant timestamp) {

    public static AuditEventResponse from(AuditEvent event) {
      return new AuditEventResponse(
          event.getId(),
          event.getProjectId(),
          event.getUserId(),
          roleValue(event.getUserRole()),
          event.getFromState().label(),
          event.getToState().label(),
          event.getReason(),
          event.getMetadata(),
          event.getOccurredAt());
    }

    private static String roleValue(PortalRole role) {
      return role != null ? role.value() : null;
    }
  }
}
