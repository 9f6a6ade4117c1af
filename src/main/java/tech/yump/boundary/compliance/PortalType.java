package tech.yump.boundary.compliance;

import java.util.Locale;

/**
 * Portals audited separately; each can carry its own additional checks.
 */
public enum PortalType {
    ADMIN,
    CUSTOMER,
    MANAGEMENT,
    RESELLER,
    TECHNICIAN;

    public String portalName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PortalType fromName(String name) {
        for (PortalType type : values()) {
            if (type.portalName().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown portal type: " + name);
    }
}
