package org.digitera.delivery.domain;

public enum EntitlementStatus {
    ACTIVE,
    EXHAUSTED,
    REVOKED
}
