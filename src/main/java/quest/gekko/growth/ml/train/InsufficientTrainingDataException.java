package quest.gekko.growth.ml.train;

public class InsufficientTrainingDataException extends RuntimeException {
    private final int rows;
    private final int required;

    public InsufficientTrainingDataException(int rows, int required) {
        super("Not enough training data: " + rows + " labeled rows, at least " + required + " required");
        this.rows = rows;
        this.required = required;
    }

    public int getRows() {
        return rows;
    }

    public int getRequired() {
        return required;
    }
}
