package co.deferworks.cadence.core.exception;

import java.util.UUID;

public class JobNotFoundException extends SchedulerException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
