package tech.yump.boundary.compliance;

/**
 * Severity of a compliance violation, with its default score penalty.
 */
public enum Severity {
    CRITICAL(25),
    HIGH(15),
    MEDIUM(10),
    LOW(5),
    INFO(1);

    private final double defaultWeight;

    Severity(double defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public double defaultWeight() {
        return defaultWeight;
    }
}
