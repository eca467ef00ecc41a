package com.ivamare.eventbus.model;

import java.util.Arrays;

/**
 * Known consumers. Each one owns exactly one business queue and one audit queue.
 */
public enum Microservice {

    AUTH("auth"),
    ORDERS("orders"),
    PAYMENTS("payments"),
    INVENTORY("inventory"),
    SOCIAL("social"),
    NOTIFICATIONS("notifications"),
    AUDIT_EDA("audit-eda");

    private final String value;

    Microservice(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolve a microservice from its wire value or its constant name.
     *
     * @param value e.g. {@code "payments"} or {@code "PAYMENTS"}
     * @return the microservice
     * @throws IllegalArgumentException if the value is unknown
     */
    public static Microservice fromValue(String value) {
        return Arrays.stream(values())
            .filter(m -> m.value.equalsIgnoreCase(value) || m.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown microservice: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
