package quest.gekko.growth.job;

public class JobAlreadyRunningException extends RuntimeException {
    public JobAlreadyRunningException(JobStatus running) {
        super("Another job is already running: " + running.type() + " since " + running.startedAt());
    }
}
