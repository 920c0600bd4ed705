package io.meshcapture.portal.project;

import io.meshcapture.portal.audit.AuditEventBuilder;
import io.meshcapture.portal.audit.AuditEventRecord;
import io.meshcapture.portal.audit.AuditProperties;
import io.meshcapture.portal.audit.AuditService;
import io.meshcapture.portal.audit.AuditTimestampSource;
import io.meshcapture.portal.exception.ForbiddenException;
import io.meshcapture.portal.exception.InvalidRequestException;
import io.meshcapture.portal.exception.ProjectNotFoundException;
import io.meshcapture.portal.exception.TransitionRejectedException;
import io.meshcapture.portal.lifecycle.LifecycleQueries;
import io.meshcapture.portal.lifecycle.PortalRole;
import io.meshcapture.portal.lifecycle.ProjectState;
import io.meshcapture.portal.lifecycle.TransitionValidator;
import io.meshcapture.portal.security.ActingUser;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private static final Set<PortalRole> CREATOR_ROLES =
      EnumSet.of(PortalRole.ADMIN, PortalRole.SALES_LEAD, PortalRole.CUSTOMER_OWNER);

  private final ProjectRepository repository;
  private final AuditService auditService;
  private final AuditProperties auditProperties;
  private final AuditTimestampSource timestampSource;

  public ProjectService(
      ProjectRepository repository,
      AuditService auditService,
      AuditProperties auditProperties,
      AuditTimestampSource timestampSource) {
    this.repository = repository;
    this.auditService = auditService;
    this.auditProperties = auditProperties;
    this.timestampSource = timestampSource;
  }

  /** Outcome of a committed (or idempotent) transition request. */
  public record TransitionResult(Project project, boolean changed, AuditEventRecord auditEvent) {}

  /** One action the acting user can take from the project's current state. */
  public record AvailableTransition(
      ProjectState targetState, String description, boolean requiresApproval) {}

  @Transactional
  public Project createProject(
      String name, String description, String customerId, ActingUser actor) {
    if (!CREATOR_ROLES.contains(actor.role())) {
      throw new ForbiddenException(
          "Cannot request project",
          "Role '" + actor.role().value() + "' cannot request capture projects");
    }
    var project = repository.save(new Project(name, description, customerId, actor.userId()));
    log.info("Project {} requested by user {} ({})", project.getId(), actor.userId(), actor.role());
    return project;
  }

  @Transactional(readOnly = true)
  public Project getProject(UUID projectId) {
    return repository
        .findById(projectId)
        .orElseThrow(() -> new ProjectNotFoundException(projectId));
  }

  @Transactional(readOnly = true)
  public List<Project> listProjects(ProjectState state) {
    if (state == null) {
      return repository.findAllByOrderByCreatedAtDesc();
    }
    return repository.findByStateOrderByCreatedAtDesc(state);
  }

  /**
   * Validates and commits a state change, appending the audit event in the same transaction. The
   * entity's {@code @Version} makes a concurrent change to the same project fail on flush instead
   * of both moves being applied against a stale state.
   *
   * <p>A request for the state the project is already in returns the project unchanged and records
   * nothing.
   *
   * @throws ProjectNotFoundException if the project does not exist
   * @throws TransitionRejectedException if the move is not in the lifecycle or not open to the role
   * @throws InvalidRequestException if the reason exceeds the configured length
   */
  @Transactional
  public TransitionResult transition(
      UUID projectId,
      ProjectState targetState,
      ActingUser actor,
      String reason,
      Map<String, Object> metadata) {
    if (reason != null && reason.length() > auditProperties.maxReasonLength()) {
      throw new InvalidRequestException(
          "Reason must be at most " + auditProperties.maxReasonLength() + " characters");
    }

    var project = getProject(projectId);
    ProjectState currentState = project.getState();

    var decision = TransitionValidator.validate(currentState, targetState, actor.role());
    if (!decision.valid()) {
      log.warn(
          "Rejected transition for project {}: {} -> {} by user {} ({}): {}",
          projectId,
          currentState,
          targetState,
          actor.userId(),
          actor.role(),
          decision.error());
      throw new TransitionRejectedException(currentState, targetState, decision);
    }
    if (decision.isNoOp()) {
      log.debug("Project {} already in state {}, nothing to do", projectId, currentState);
      return new TransitionResult(project, false, null);
    }

    var rule = decision.rule();
    project.applyTransition(targetState);
    project = repository.saveAndFlush(project);

    var auditEvent =
        AuditEventBuilder.builder(timestampSource)
            .projectId(projectId.toString())
            .userId(actor.userId())
            .userRole(actor.role())
            .fromState(currentState)
            .toState(targetState)
            .reason(reason)
            .metadata(metadata)
            .metadata("description", rule.description())
            .metadata("requires_approval", rule.requiresApproval())
            .metadata("payout_eligible", LifecycleQueries.isPayoutEligible(targetState))
            .build();
    auditService.log(auditEvent);

    log.info(
        "Project {} moved {} -> {} by user {} ({})",
        projectId,
        currentState,
        targetState,
        actor.userId(),
        actor.role());
    return new TransitionResult(project, true, auditEvent);
  }

  /** Actions {@code actor} can take on the project right now, in happy-path order. */
  @Transactional(readOnly = true)
  public List<AvailableTransition> availableTransitions(UUID projectId, ActingUser actor) {
    ProjectState current = getProject(projectId).getState();
    return LifecycleQueries.validNextStates(current, actor.role()).stream()
        .map(
            target ->
                new AvailableTransition(
                    target,
                    LifecycleQueries.description(current, target),
                    LifecycleQueries.requiresApproval(current, target)))
        .toList();
  }
}
