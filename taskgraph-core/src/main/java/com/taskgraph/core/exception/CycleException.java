package com.taskgraph.core.exception;

/**
 * Thrown when adding a dependency edge would close a cycle.
 */
public class CycleException extends ValidationException {

    public static final String ERROR_CODE = "CYCLE_DETECTED";

    private final String dependent;
    private final String dependsOn;

    public CycleException(String dependent, String dependsOn) {
        super(ERROR_CODE, String.format(
            "Edge %s -> %s would create a cycle", dependent, dependsOn), null);
        this.dependent = dependent;
        this.dependsOn = dependsOn;
    }

    public String getDependent() {
        return dependent;
    }

    public String getDependsOn() {
        return dependsOn;
    }
}
