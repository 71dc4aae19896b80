package quest.gekko.growth.ml.train;

/**
 * Point in time the features of a training row are extracted at.
 */
public enum FeatureAnchor {
    /** Features as they are now, paired with growth that has already happened. */
    CURRENT,
    /** Features as they stood at the start of the labeled horizon. */
    BASELINE
}
