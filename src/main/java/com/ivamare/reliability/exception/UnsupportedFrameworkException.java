package com.ivamare.reliability.exception;

/**
 * Raised when a compliance report is requested for a framework with no rule.
 */
public class UnsupportedFrameworkException extends ReliabilityException {

    private final String framework;

    public UnsupportedFrameworkException(String framework) {
        super("Compliance framework " + framework + " not supported");
        this.framework = framework;
    }

    public String getFramework() {
        return framework;
    }
}
