package io.meshcapture.portal.audit;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/** Renders audit events as CSV for compliance exports. One row per event, header first. */
@Component
public class AuditEventCsvWriter {

  static final List<String> COLUMNS =
      List.of(
          "id",
          "occurred_at",
          "project_id",
          "user_id",
          "user_role",
          "from_state",
          "to_state",
          "reason",
          "metadata");

  private final ObjectMapper objectMapper;

  public AuditEventCsvWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public void writeCsv(List<AuditEvent> events, OutputStream outputStream) throws IOException {
    var writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));

    writer.write(String.join(",", COLUMNS));
    writer.newLine();

    for (AuditEvent event : events) {
      writer.write(
          Stream.of(
                  event.getId() != null ? event.getId().toString() : null,
                  String.valueOf(event.getOccurredAt()),
                  event.getProjectId(),
                  event.getUserId(),
                  event.getUserRole() != null ? event.getUserRole().value() : null,
                  event.getFromState().label(),
                  event.getToState().label(),
                  event.getReason(),
                  metadataJson(event.getMetadata()))
              .map(AuditEventCsvWriter::escapeCsv)
              .collect(Collectors.joining(",")));
      writer.newLine();
    }

    writer.flush();
  }

  private String metadataJson(Map<String, Object> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return null;
    }
    return objectMapper.writeValueAsString(metadata);
  }

  static String escapeCsv(String value) {
    if (value == null) {
      return "";
    }
    // Defuse spreadsheet formula injection
    if (!value.isEmpty() && "=+-@\t\r".indexOf(value.charAt(0)) >= 0) {
      value = "'" + value;
    }
    if (value.contains(",")
        || value.contains("\"")
        || value.contains("\n")
        || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
