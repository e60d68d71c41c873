package com.phillippitts.vibedj.exception;

/**
 * Thrown when an oracle (vibe planner or recommender) is unreachable or returns a
 * response that violates its contract.
 */
public class OracleException extends VibeDjException {

    private final String oracleName;

    public OracleException(String message, String oracleName) {
        super(message + " (oracle: " + oracleName + ")");
        this.oracleName = oracleName;
    }

    public OracleException(String message, String oracleName, Throwable cause) {
        super(message + " (oracle: " + oracleName + ")", cause);
        this.oracleName = oracleName;
    }

    public String getOracleName() {
        return oracleName;
    }
}
