package com.ivamare.eventbus.exception;

/**
 * Raised when exchanges, queues or bindings cannot be declared. Fatal at startup.
 */
public class TopologyException extends EventBusException {

    private final String resource;

    public TopologyException(String resource, Throwable cause) {
        super("Failed to declare " + resource + ": " + cause.getMessage(), cause);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
