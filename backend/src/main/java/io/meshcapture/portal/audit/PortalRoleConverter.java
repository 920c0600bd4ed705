package io.meshcapture.portal.audit;

import io.meshcapture.portal.lifecycle.PortalRole;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link PortalRole} by its wire value ({@code "customer_owner"}), not its enum name. */
@Converter
public class PortalRoleConverter implements AttributeConverter<PortalRole, String> {

  @Override
  public String convertToDatabaseColumn(PortalRole role) {
    return role != null ? role.value() : null;
  }

  @Override
  public PortalRole convertToEntityAttribute(String value) {
    return value != null ? PortalRole.fromValue(value) : null;
  }
}
