package domain.model;

/**
 * The fixed machine-sized numeric domain the search operates in.
 *
 * <p>Both domains store values as {@code double}:
 * <ul>
 *   <li><b>INTEGER</b>: every value is integral; division is accepted only when exact;
 *       goal matching is exact equality.</li>
 *   <li><b>REAL</b>: any non-zero divisor is accepted; a value within the configured
 *       tolerance of the goal counts as the goal.</li>
 * </ul>
 *
 * <p>Values are used as hash keys, so every value passes through {@link #canonical(double)}
 * first: {@code -0.0} and {@code 0.0} must map to the same key.
 */
public enum NumericDomain {

    INTEGER {
        @Override
        public boolean isDivisionValid(double dividend, double divisor) {
            return divisor != 0.0 && dividend % divisor == 0.0;
        }

        @Override
        public boolean matchesGoal(double value, double goal, double tolerance) {
            return value == goal;
        }

        @Override
        public String format(double value) {
            return Long.toString((long) value);
        }
    },

    REAL {
        @Override
        public boolean isDivisionValid(double dividend, double divisor) {
            return divisor != 0.0;
        }

        @Override
        public boolean matchesGoal(double value, double goal, double tolerance) {
            return Math.abs(value - goal) <= tolerance;
        }

        @Override
        public String format(double value) {
            if (value == Math.rint(value) && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }
    };

    /**
     * Returns whether {@code dividend / divisor} is a valid candidate in this domain.
     *
     * @param dividend left operand
     * @param divisor  right operand
     * @return {@code true} if a DIV candidate may be produced
     */
    public abstract boolean isDivisionValid(double dividend, double divisor);

    /**
     * Returns whether a discovered value counts as the goal.
     *
     * @param value     discovered value
     * @param goal      target value
     * @param tolerance allowed absolute deviation (ignored by {@link #INTEGER})
     * @return {@code true} if {@code value} should be treated as the goal
     */
    public abstract boolean matchesGoal(double value, double goal, double tolerance);

    /**
     * Formats a literal for display.
     *
     * @param value the value to format
     * @return locale-independent textual form
     */
    public abstract String format(double value);

    /**
     * Maps a value to its canonical key form ({@code -0.0} becomes {@code 0.0}).
     *
     * @param value any value
     * @return the value to use as a store key
     */
    public double canonical(double value) {
        return value == 0.0 ? 0.0 : value;
    }
}
