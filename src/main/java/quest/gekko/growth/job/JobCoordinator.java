package quest.gekko.growth.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Lets at most one batch job (predict or train) run at a time. A job requested while another is running is rejected
 * immediately, never queued.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobCoordinator {

    private final Clock clock;
    private final AtomicReference<JobStatus> current = new AtomicReference<>(JobStatus.idle());

    public JobStatus status() {
        return current.get();
    }

    /**
     * Runs {@code job} exclusively. The job's return value becomes the completion message; an exception or error marks
     * the status as failed and is rethrown to the caller.
     *
     * @throws JobAlreadyRunningException if another job holds the slot
     */
    public JobStatus run(JobType type, String startMessage, Supplier<String> job) {
        JobStatus running = start(type, startMessage);
        try {
            String message = job.get();
            JobStatus done = running.completed(message, clock.instant());
            current.set(done);
            log.info("{} job completed: {}", type, message);
            return done;
        } catch (RuntimeException | Error e) {
            current.set(running.failed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), clock.instant()));
            log.error("{} job failed", type, e);
            throw e;
        }
    }

    private JobStatus start(JobType type, String message) {
        JobStatus running = new JobStatus(type, JobState.RUNNING, message, clock.instant(), null);
        JobStatus previous = current.getAndUpdate(status -> status.isRunning() ? status : running);
        if (previous.isRunning()) {
            throw new JobAlreadyRunningException(previous);
        }
        log.info("{} job started: {}", type, message);
        return running;
    }
}
