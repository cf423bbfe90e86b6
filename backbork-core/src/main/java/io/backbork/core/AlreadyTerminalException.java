package io.backbork.core;

public class AlreadyTerminalException extends BackborkException {

    private final JobStatus status;

    public AlreadyTerminalException(String jobId, JobStatus status) {
        super("Job " + jobId + " already finished with status " + status);
        this.status = status;
    }

    public JobStatus status() {
        return status;
    }
}
