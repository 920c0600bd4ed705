package io.meshcapture.portal.lifecycle;

import java.util.Locale;

/**
 * Where a capture project sits in its lifecycle. Declaration order is the canonical happy path.
 */
public enum ProjectState {
  REQUESTED("Requested", "Customer requested a project"),
  ASSIGNED("Assigned", "Project assigned to technician"),
  CAPTURED("Captured", "Raw files captured"),
  PROCESSING("Processing", "Files being processed"),
  QA("QA", "Under quality assurance review"),
  DELIVERED("Delivered", "Assets delivered to customer"),
  APPROVED("Approved", "Customer approved the delivery"),
  ARCHIVED("Archived", "Project completed and archived");

  private final String label;
  private final String summary;

  ProjectState(String label, String summary) {
    this.label = label;
    this.summary = summary;
  }

  public String label() {
    return label;
  }

  public String summary() {
    return summary;
  }

  /**
   * Parses a state from its label ({@code "QA"}, {@code "Delivered"}) or enum name ({@code
   * "DELIVERED"}), ignoring case.
   *
   * @throws IllegalArgumentException if the value names no state
   */
  public static ProjectState fromLabel(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Project state must not be null");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (ProjectState state : values()) {
      if (state.name().equals(normalized)) {
        return state;
      }
    }
    throw new IllegalArgumentException("Unknown project state: " + value);
  }

  @Override
  public String toString() {
    return label;
  }
}
