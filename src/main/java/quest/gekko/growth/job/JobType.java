package quest.gekko.growth.job;

public enum JobType {
    PREDICT,
    TRAIN
}
