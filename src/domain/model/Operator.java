package domain.model;

/**
 * Semantic kind of an {@link ExpressionNode}.
 *
 * <p>Carries only arithmetic meaning. The textual symbol used when printing an
 * expression is a presentation concern owned by
 * {@link domain.engine.ExpressionRenderer}.
 */
public enum Operator {
    /** Addition (commutative). */
    ADD,
    /** Subtraction. */
    SUB,
    /** Multiplication (commutative). */
    MUL,
    /** Division; only produced when the numeric domain accepts the quotient. */
    DIV,
    /** Marks a leaf: the node is a seed literal, not a combination. */
    NONE;

    /**
     * Applies this operator to two operand values.
     *
     * <p>No validity check is made for {@link #DIV}; callers consult
     * {@link NumericDomain#isDivisionValid(double, double)} first.
     *
     * @param left  left operand
     * @param right right operand
     * @return the arithmetic result
     * @throws UnsupportedOperationException for {@link #NONE}
     */
    public double apply(double left, double right) {
        switch (this) {
            case ADD:
                return left + right;
            case SUB:
                return left - right;
            case MUL:
                return left * right;
            case DIV:
                return left / right;
            default:
                throw new UnsupportedOperationException("Leaf marker has no arithmetic: " + this);
        }
    }
}
