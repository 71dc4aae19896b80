package quest.gekko.growth.ml.predict;

public enum PredictionMode {
    MODEL,
    RULE_BASED
}
