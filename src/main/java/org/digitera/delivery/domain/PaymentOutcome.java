package org.digitera.delivery.domain;

public enum PaymentOutcome {
    SUCCEEDED,
    FAILED
}
