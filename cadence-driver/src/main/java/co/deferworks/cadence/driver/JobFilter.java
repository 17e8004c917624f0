package co.deferworks.cadence.driver;

import co.deferworks.cadence.core.Job.JobStatus;
import co.deferworks.cadence.core.Job.JobType;

/**
 * Optional filters for listing jobs. A null field matches everything.
 */
public record JobFilter(JobStatus status, JobType type) {

    public static JobFilter all() {
        return new JobFilter(null, null);
    }

    public static JobFilter byStatus(JobStatus status) {
        return new JobFilter(status, null);
    }

    public static JobFilter byType(JobType type) {
        return new JobFilter(null, type);
    }
}
