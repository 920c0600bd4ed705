package io.meshcapture.portal.project;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.meshcapture.portal.TestcontainersConfiguration;
import io.meshcapture.portal.lifecycle.PortalRole;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ProjectLifecycleIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private JdbcTemplate jdbcTemplate;
  @Autowired private ProjectRepository projectRepository;
  @Autowired private PlatformTransactionManager transactionManager;

  @Test
  void shouldWalkHappyPathAndRecordOrderedHistory() throws Exception {
    String projectId = createProject("Happy path scan");

    transition(projectId, "Assigned", salesJwt()).andExpect(status().isOk());
    transition(projectId, "Captured", technicianJwt()).andExpect(status().isOk());
    transition(projectId, "Processing", technicianJwt()).andExpect(status().isOk());
    transition(projectId, "QA", adminJwt()).andExpect(status().isOk());
    transition(projectId, "Delivered", approverJwt()).andExpect(status().isOk());
    transition(projectId, "Approved", customerJwt())
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.project.state").value("Approved"))
        .andExpect(jsonPath("$.project.payoutEligible").value(true))
        .andExpect(jsonPath("$.project.terminal").value(true));
    transition(projectId, "Archived", adminJwt())
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.changed").value(true))
        .andExpect(jsonPath("$.recordedAt", notNullValue()));

    mockMvc
        .perform(get("/api/projects/" + projectId + "/audit-events").with(customerJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(7)))
        .andExpect(jsonPath("$[0].fromState").value("Requested"))
        .andExpect(jsonPath("$[0].toState").value("Assigned"))
        .andExpect(jsonPath("$[0].userRole").value("sales_lead"))
        .andExpect(jsonPath("$[4].metadata.requires_approval").value(true))
        .andExpect(jsonPath("$[6].toState").value("Archived"))
        .andExpect(jsonPath("$[6].userId").value("user_admin"));
  }

  @Test
  void shouldLoopBackToCapturedWhenQaRejects() throws Exception {
    String projectId = projectInQa("Retake scan");

    transition(projectId, "Captured", approverJwt(), "Blurry textures")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.project.state").value("Captured"));

    mockMvc
        .perform(get("/api/projects/" + projectId + "/audit-events").with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[4].fromState").value("QA"))
        .andExpect(jsonPath("$[4].toState").value("Captured"))
        .andExpect(jsonPath("$[4].reason").value("Blurry textures"));
  }

  @Test
  void shouldForbidCustomerApprovingQa() throws Exception {
    String projectId = projectInQa("Role gated scan");

    transition(projectId, "Delivered", customerJwt())
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.rejection").value("ROLE_NOT_PERMITTED"))
        .andExpect(
            jsonPath("$.detail")
                .value(
                    "role 'customer_owner' cannot perform this transition; required one of:"
                        + " approver"));
  }

  @Test
  void shouldRejectShortcutWithConflict() throws Exception {
    String projectId = createProject("Shortcut scan");

    transition(projectId, "Delivered", adminJwt())
        .andExpect(status().isConflict())
        .andExpect(
            jsonPath("$.detail").value("transition from Requested to Delivered not allowed"));

    mockMvc
        .perform(get("/api/projects/" + projectId).with(adminJwt()))
        .andExpect(jsonPath("$.state").value("Requested"));
  }

  @Test
  void shouldTreatDuplicateSubmitAsNoOp() throws Exception {
    String projectId = createProject("Duplicate submit scan");
    transition(projectId, "Assigned", adminJwt()).andExpect(status().isOk());

    transition(projectId, "Assigned", adminJwt())
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.changed").value(false))
        .andExpect(jsonPath("$.recordedAt", nullValue()));

    mockMvc
        .perform(get("/api/projects/" + projectId + "/audit-events").with(adminJwt()))
        .andExpect(jsonPath("$", hasSize(1)));
  }

  @Test
  void shouldListAvailableTransitionsForRole() throws Exception {
    String projectId = projectInQa("Available actions scan");

    mockMvc
        .perform(get("/api/projects/" + projectId + "/transitions").with(approverJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(3)))
        .andExpect(jsonPath("$[0].targetState").value("Captured"))
        .andExpect(jsonPath("$[1].targetState").value("Delivered"))
        .andExpect(jsonPath("$[1].requiresApproval").value(true))
        .andExpect(jsonPath("$[2].targetState").value("Archived"));

    mockMvc
        .perform(get("/api/projects/" + projectId + "/transitions").with(technicianJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(0)));
  }

  @Test
  void shouldRejectTechnicianCreatingProject() throws Exception {
    mockMvc
        .perform(
            post("/api/projects")
                .with(technicianJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"name": "Not allowed"}
                    """))
        .andExpect(status().isForbidden());
  }

  @Test
  void shouldRejectUnknownTargetState() throws Exception {
    String projectId = createProject("Unknown state scan");

    transition(projectId, "In Progress", adminJwt()).andExpect(status().isBadRequest());
  }

  @Test
  void shouldRequireAuthentication() throws Exception {
    mockMvc.perform(get("/api/lifecycle")).andExpect(status().isUnauthorized());
  }

  @Test
  void shouldDescribeLifecycle() throws Exception {
    mockMvc
        .perform(get("/api/lifecycle").with(technicianJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.happyPath", hasSize(8)))
        .andExpect(jsonPath("$.happyPath[0]").value("Requested"))
        .andExpect(jsonPath("$.payoutEligibleStates[0]").value("Approved"))
        .andExpect(jsonPath("$.transitions", hasSize(15)));

    mockMvc
        .perform(
            get("/api/lifecycle/check")
                .param("from", "Processing")
                .param("to", "Archived")
                .param("role", "technician")
                .with(technicianJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.valid").value(false))
        .andExpect(jsonPath("$.description").value("Cancel project"));
  }

  @Test
  void shouldRestrictGlobalAuditQueryToAdmins() throws Exception {
    mockMvc
        .perform(get("/api/audit-events").with(approverJwt()))
        .andExpect(status().isForbidden());
    mockMvc.perform(get("/api/audit-events").with(adminJwt())).andExpect(status().isOk());
  }

  @Test
  void auditTableShouldBeAppendOnly() throws Exception {
    String projectId = createProject("Append only scan");
    transition(projectId, "Assigned", adminJwt()).andExpect(status().isOk());

    assertThatThrownBy(
            () ->
                jdbcTemplate.update(
                    "UPDATE project_audit_events SET reason = 'edited' WHERE project_id = ?",
                    projectId))
        .isInstanceOf(DataAccessException.class);
    assertThatThrownBy(
            () ->
                jdbcTemplate.update(
                    "DELETE FROM project_audit_events WHERE project_id = ?", projectId))
        .isInstanceOf(DataAccessException.class);
  }

  @Test
  void staleConcurrentTransitionShouldConflictAndLeaveOneAuditRow() throws Exception {
    String projectId = createProject("Concurrent scan");
    var staleLoaded = new CountDownLatch(1);
    var freshCommitted = new CountDownLatch(1);
    var transactionTemplate = new TransactionTemplate(transactionManager);
    var executor = Executors.newSingleThreadExecutor();
    try {
      // Loads the project at its initial version, then submits once the other move has committed
      Future<MvcResult> stale =
          executor.submit(
              () ->
                  transactionTemplate.execute(
                      tx -> {
                        tx.setRollbackOnly();
                        projectRepository.findById(UUID.fromString(projectId)).orElseThrow();
                        staleLoaded.countDown();
                        awaitQuietly(freshCommitted);
                        try {
                          return transition(projectId, "Assigned", salesJwt(), "second click")
                              .andReturn();
                        } catch (Exception e) {
                          throw new IllegalStateException(e);
                        }
                      }));

      assertThat(staleLoaded.await(10, TimeUnit.SECONDS)).isTrue();
      transition(projectId, "Assigned", adminJwt()).andExpect(status().isOk());
      freshCommitted.countDown();

      var response = stale.get(30, TimeUnit.SECONDS).getResponse();
      assertThat(response.getStatus()).isEqualTo(409);
      assertThat((String) JsonPath.read(response.getContentAsString(), "$.title"))
          .isEqualTo("Concurrent modification");
    } finally {
      executor.shutdownNow();
    }

    mockMvc
        .perform(get("/api/projects/" + projectId + "/audit-events").with(adminJwt()))
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].userId").value("user_admin"));
    mockMvc
        .perform(get("/api/projects/" + projectId).with(adminJwt()))
        .andExpect(jsonPath("$.state").value("Assigned"));
  }

  @Test
  void shouldRejectUnknownRoleInLifecycleCheck() throws Exception {
    mockMvc
        .perform(
            get("/api/lifecycle/check")
                .param("from", "QA")
                .param("to", "Delivered")
                .param("role", "superuser")
                .with(adminJwt()))
        .andExpect(status().isBadRequest())
        .andExpect(
            jsonPath("$.detail").value("Parameter 'role' is not a valid portal role: superuser"));
  }

  @Test
  void shouldFetchSingleAuditEventForAdmins() throws Exception {
    String projectId = createProject("Single event scan");
    transition(projectId, "Assigned", salesJwt(), "Kickoff").andExpect(status().isOk());
    var history =
        mockMvc
            .perform(get("/api/projects/" + projectId + "/audit-events").with(adminJwt()))
            .andReturn();
    String eventId = JsonPath.read(history.getResponse().getContentAsString(), "$[0].id");

    mockMvc
        .perform(get("/api/audit-events/" + eventId).with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(eventId))
        .andExpect(jsonPath("$.projectId").value(projectId))
        .andExpect(jsonPath("$.reason").value("Kickoff"));
    mockMvc
        .perform(get("/api/audit-events/" + eventId).with(approverJwt()))
        .andExpect(status().isForbidden());
    mockMvc
        .perform(get("/api/audit-events/" + UUID.randomUUID()).with(adminJwt()))
        .andExpect(status().isNotFound());
  }

  @Test
  void shouldExportFilteredAuditEvents() throws Exception {
    String projectId = createProject("Export scan");
    transition(projectId, "Assigned", adminJwt()).andExpect(status().isOk());
    transition(projectId, "Captured", technicianJwt(), "Shot, twice").andExpect(status().isOk());

    var csv =
        mockMvc
            .perform(
                get("/api/audit-events/export")
                    .param("format", "csv")
                    .param("projectId", projectId)
                    .with(adminJwt()))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith("text/csv"))
            .andExpect(
                header()
                    .string(
                        HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"project-audit-events.csv\""))
            .andReturn()
            .getResponse()
            .getContentAsString(StandardCharsets.UTF_8);
    var lines = csv.lines().toList();
    assertThat(lines).hasSize(3);
    assertThat(lines.get(0)).startsWith("id,occurred_at,project_id");
    assertThat(lines.get(1)).contains(",Assigned,Captured,\"Shot, twice\",");
    assertThat(lines.get(2)).contains(",Requested,Assigned,,");

    mockMvc
        .perform(
            get("/api/audit-events/export")
                .param("format", "json")
                .param("projectId", projectId)
                .param("toState", "Captured")
                .with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].toState").value("Captured"));

    mockMvc
        .perform(get("/api/audit-events/export").param("format", "xml").with(adminJwt()))
        .andExpect(status().isBadRequest());
    mockMvc
        .perform(get("/api/audit-events/export").with(customerJwt()))
        .andExpect(status().isForbidden());
  }

  // --- Helpers ---

  private String createProject(String name) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/projects")
                    .with(salesJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "%s", "description": "Integration test", "customerId": "cust_it"}
                        """
                            .formatted(name)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.state").value("Requested"))
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private String projectInQa(String name) throws Exception {
    String projectId = createProject(name);
    transition(projectId, "Assigned", adminJwt()).andExpect(status().isOk());
    transition(projectId, "Captured", technicianJwt()).andExpect(status().isOk());
    transition(projectId, "Processing", technicianJwt()).andExpect(status().isOk());
    transition(projectId, "QA", technicianJwt()).andExpect(status().isOk());
    return projectId;
  }

  private org.springframework.test.web.servlet.ResultActions transition(
      String projectId, String targetState, JwtRequestPostProcessor jwt) throws Exception {
    return transition(projectId, targetState, jwt, null);
  }

  private org.springframework.test.web.servlet.ResultActions transition(
      String projectId, String targetState, JwtRequestPostProcessor jwt, String reason)
      throws Exception {
    String body =
        reason == null
            ? """
              {"targetState": "%s"}
              """
                .formatted(targetState)
            : """
              {"targetState": "%s", "reason": "%s"}
              """
                .formatted(targetState, reason);
    return mockMvc.perform(
        post("/api/projects/" + projectId + "/transitions")
            .with(jwt)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body));
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      if (!latch.await(10, TimeUnit.SECONDS)) {
        throw new IllegalStateException("Timed out waiting for the competing transition");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }

  private JwtRequestPostProcessor adminJwt() {
    return portalJwt("user_admin", PortalRole.ADMIN);
  }

  private JwtRequestPostProcessor salesJwt() {
    return portalJwt("user_sales", PortalRole.SALES_LEAD);
  }

  private JwtRequestPostProcessor technicianJwt() {
    return portalJwt("user_tech", PortalRole.TECHNICIAN);
  }

  private JwtRequestPostProcessor approverJwt() {
    return portalJwt("user_approver", PortalRole.APPROVER);
  }

  private JwtRequestPostProcessor customerJwt() {
    return portalJwt("user_customer", PortalRole.CUSTOMER_OWNER);
  }

  private JwtRequestPostProcessor portalJwt(String subject, PortalRole role) {
    return jwt()
        .jwt(j -> j.subject(subject).claim("role", role.value()))
        .authorities(new SimpleGrantedAuthority(role.authority()));
  }
}
