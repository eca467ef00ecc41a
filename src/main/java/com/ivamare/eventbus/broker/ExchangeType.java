package com.ivamare.eventbus.broker;

/**
 * AMQP exchange types used by the bus.
 */
public enum ExchangeType {

    DIRECT("direct"),
    HEADERS("headers");

    private final String value;

    ExchangeType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
