package quest.gekko.growth.job;

public enum JobState {
    IDLE,
    RUNNING,
    COMPLETED,
    ERROR
}
