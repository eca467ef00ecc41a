package com.ivamare.eventbus.saga;

import com.ivamare.eventbus.exception.EventBusException;

/**
 * Thrown by a saga step when it fails for a business reason and the saga must compensate.
 *
 * <p>Unlike other exceptions this does not trigger a retry: the step's compensation event is
 * published and the delivery completes normally.
 */
public class StepFailedException extends EventBusException {

    private final String stepName;
    private final String errorCode;

    /**
     * @param stepName The name of the failed step
     * @param errorCode Error code for the failure
     * @param message Detailed error message
     */
    public StepFailedException(String stepName, String errorCode, String message) {
        super("Step " + stepName + " failed: " + message);
        this.stepName = stepName;
        this.errorCode = errorCode;
    }

    public StepFailedException(String stepName, String errorCode, String message, Throwable cause) {
        super("Step " + stepName + " failed: " + message, cause);
        this.stepName = stepName;
        this.errorCode = errorCode;
    }

    public String getStepName() {
        return stepName;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
