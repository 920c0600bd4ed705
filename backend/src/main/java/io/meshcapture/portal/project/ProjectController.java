package io.meshcapture.portal.project;

import io.meshcapture.portal.exception.RequestParameters;
import io.meshcapture.portal.lifecycle.LifecycleQueries;
import io.meshcapture.portal.security.ActingUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

  private final ProjectService projectService;

  public ProjectController(ProjectService projectService) {
    this.projectService = projectService;
  }

  @GetMapping
  public ResponseEntity<List<ProjectResponse>> listProjects(
      @RequestParam(required = false) String state) {
    var filter = RequestParameters.optionalState("state", state);
    var projects =
        projectService.listProjects(filter).stream().map(ProjectResponse::from).toList();
    return ResponseEntity.ok(projects);
  }

  @GetMapping("/{id}")
  public ResponseEntity<ProjectResponse> getProject(@PathVariable UUID id) {
    return ResponseEntity.ok(ProjectResponse.from(projectService.getProject(id)));
  }

  @PostMapping
  public ResponseEntity<ProjectResponse> createProject(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody CreateProjectRequest request) {
    var project =
        projectService.createProject(
            request.name(), request.description(), request.customerId(), ActingUser.from(jwt));
    return ResponseEntity.created(URI.create("/api/projects/" + project.getId()))
        .body(ProjectResponse.from(project));
  }

  @PostMapping("/{id}/transitions")
  public ResponseEntity<TransitionResponse> transition(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable UUID id,
      @Valid @RequestBody TransitionRequest request) {
    var result =
        projectService.transition(
            id,
            RequestParameters.requireState("targetState", request.targetState()),
            ActingUser.from(jwt),
            request.reason(),
            request.metadata());
    return ResponseEntity.ok(TransitionResponse.from(result));
  }

  @GetMapping("/{id}/transitions")
  public ResponseEntity<List<AvailableTransitionResponse>> availableTransitions(
      @AuthenticationPrincipal Jwt jwt, @PathVariable UUID id) {
    var transitions =
        projectService.availableTransitions(id, ActingUser.from(jwt)).stream()
            .map(AvailableTransitionResponse::from)
            .toList();
    return ResponseEntity.ok(transitions);
  }

  // --- DTOs ---

  public record CreateProjectRequest(
      @NotBlank(message = "name is required") @Size(max = 255) String name,
      String description,
      @Size(max = 255) String customerId) {}

  public record TransitionRequest(
      @NotBlank(message = "targetState is required") String targetState,
      String reason,
      Map<String, Object> metadata) {}

  public record ProjectResponse(
      UUID id,
      String name,
      String description,
      String customerId,
      String state,
      String stateSummary,
      int progressIndex,
      boolean terminal,
      boolean payoutEligible,
      String createdBy,
      Instant createdAt,
      Instant updatedAt,
      Instant stateChangedAt) {

    public static ProjectResponse from(Project project) {
      var state = project.getState();
      return new ProjectResponse(
          project.getId(),
          project.getName(),
          project.getDescription(),
          project.getCustomerId(),
          state.label(),
          state.summary(),
          LifecycleQueries.progressIndex(state),
          LifecycleQueries.isTerminal(state),
          LifecycleQueries.isPayoutEligible(state),
          project.getCreatedBy(),
          project.getCreatedAt(),
          project.getUpdatedAt(),
          project.getStateChangedAt());
    }
  }

  public record TransitionResponse(
      ProjectResponse project, boolean changed, Instant recordedAt) {

    public static TransitionResponse from(ProjectService.TransitionResult result) {
      return new TransitionResponse(
          ProjectResponse.from(result.project()),
          result.changed(),
          result.auditEvent() != null ? result.auditEvent().timestamp() : null);
    }
  }

  public record AvailableTransitionResponse(
      String targetState, String description, boolean requiresApproval) {

    public static AvailableTransitionResponse from(ProjectService.AvailableTransition transition) {
      return new AvailableTransitionResponse(
          transition.targetState().label(),
          transition.description(),
          transition.requiresApproval());
    }
  }
}
