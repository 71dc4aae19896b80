package quest.gekko.growth.service;

/**
 * Outcome of a sequential per-channel batch; failed channels are counted, not fatal.
 */
public record BatchReport(int succeeded, int total) {

    public int failed() {
        return total - succeeded;
    }

    @Override
    public String toString() {
        return succeeded + "/" + total;
    }
}
