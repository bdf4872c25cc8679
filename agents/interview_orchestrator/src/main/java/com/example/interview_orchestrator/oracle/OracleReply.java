package com.example.interview_orchestrator.oracle;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outcome of one oracle round trip: either the extracted JSON object, or the reason there is none.
 */
public record OracleReply(Status status, ObjectNode payload, String detail) {

    public enum Status {
        OK,
        MALFORMED,
        UNAVAILABLE
    }

    public static OracleReply ok(ObjectNode payload) {
        return new OracleReply(Status.OK, payload, null);
    }

    public static OracleReply malformed(String detail) {
        return new OracleReply(Status.MALFORMED, null, detail);
    }

    public static OracleReply unavailable(String detail) {
        return new OracleReply(Status.UNAVAILABLE, null, detail);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
