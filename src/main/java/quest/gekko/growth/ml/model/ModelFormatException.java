package quest.gekko.growth.ml.model;

import java.io.IOException;

/**
 * The artifact exists but was written by an incompatible or unknown format, or is damaged.
 */
public class ModelFormatException extends IOException {
    public ModelFormatException(String message) {
        super(message);
    }

    public ModelFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
