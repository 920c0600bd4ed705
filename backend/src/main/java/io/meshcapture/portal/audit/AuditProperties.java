package io.meshcapture.portal.audit;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for transition audit records.
 *
 * @param maxReasonLength longest reason text accepted with a transition request
 * @param maxPageSize upper bound on the page size of audit queries
 * @param maxExportRows upper bound on the number of events in one export
 */
@ConfigurationProperties(prefix = "portal.audit")
public record AuditProperties(int maxReasonLength, int maxPageSize, int maxExportRows) {

  public AuditProperties {
    if (maxReasonLength <= 0) {
      maxReasonLength = 1000;
    }
    if (maxPageSize <= 0) {
      maxPageSize = 200;
    }
    if (maxExportRows <= 0) {
      maxExportRows = 10_000;
    }
  }
}
