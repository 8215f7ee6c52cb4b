package com.speckle.model;

public class BatchResult {
    public enum Status { COMPLETED, FAILED }

    public final int batchId;
    public final Status status;
    public final int exitCode;

    public BatchResult(int batchId, int exitCode) {
        this.batchId = batchId;
        this.exitCode = exitCode;
        this.status = (exitCode == 0) ? Status.COMPLETED : Status.FAILED;
    }

    public boolean failed() { return status == Status.FAILED; }
}
