package io.flowcheck.model;

/**
 * Thrown when a flowchart violates the basic input contract:
 * missing node or edge collections, a node without an id, unreadable JSON.
 * Everything else is reported as an analysis result instead.
 */
public class InvalidFlowchartException extends RuntimeException {

    public InvalidFlowchartException(String message) {
        super(message);
    }

    public InvalidFlowchartException(String message, Throwable cause) {
        super(message, cause);
    }
}
