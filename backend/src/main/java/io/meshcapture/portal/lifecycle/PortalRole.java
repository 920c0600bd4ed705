package io.meshcapture.portal.lifecycle;

/**
 * Capability class of the acting user. Resolution of a user's role for a given project happens
 * before the lifecycle core is called.
 */
public enum PortalRole {
  ADMIN("admin"),
  SALES_LEAD("sales_lead"),
  TECHNICIAN("technician"),
  APPROVER("approver"),
  CUSTOMER_OWNER("customer_owner");

  private static final String AUTHORITY_PREFIX = "ROLE_";

  private final String value;

  PortalRole(String value) {
    this.value = value;
  }

  /** Wire value as carried in tokens and audit records, e.g. {@code "sales_lead"}. */
  public String value() {
    return value;
  }

  /** Spring Security authority, e.g. {@code "ROLE_SALES_LEAD"}. */
  public String authority() {
    return AUTHORITY_PREFIX + name();
  }

  /**
   * @throws IllegalArgumentException if the value names no role
   */
  public static PortalRole fromValue(String value) {
    for (PortalRole role : values()) {
      if (role.value.equals(value)) {
        return role;
      }
    }
    throw new IllegalArgumentException("Unknown portal role: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
