package quest.gekko.growth.job;

import java.time.Instant;

/**
 * Immutable snapshot of the most recent batch job. A new value replaces the old one on every transition.
 */
public record JobStatus(JobType type, JobState state, String message, Instant startedAt, Instant completedAt) {

    public static JobStatus idle() {
        return new JobStatus(null, JobState.IDLE, "", null, null);
    }

    public boolean isRunning() {
        return state == JobState.RUNNING;
    }

    JobStatus completed(String message, Instant at) {
        return new JobStatus(type, JobState.COMPLETED, message, startedAt, at);
    }

    JobStatus failed(String message, Instant at) {
        return new JobStatus(type, JobState.ERROR, message, startedAt, at);
    }
}
