package domain.model;

import java.util.Objects;

/**
 * One candidate expression, identified by the value it evaluates to.
 *
 * <p>A node does not point at its children. It records the <em>values</em> of its two
 * operands; the operand expressions are found by looking those values up in the
 * search's value-keyed stores. Different expressions may therefore share one sub-value,
 * and the overall structure is a DAG rather than a tree.
 *
 * <h3>Key Concepts</h3>
 * <ul>
 *   <li><b>value</b>: the numeric result of the expression; the lookup key.</li>
 *   <li><b>leftValue / rightValue</b>: operand values; both equal {@code value} for a leaf.</li>
 *   <li><b>termCount</b>: the cost: number of leaf literals in the expression.</li>
 *   <li><b>operator</b>: how the operands were combined; {@link Operator#NONE} for a leaf.</li>
 * </ul>
 *
 * <h3>Immutability</h3>
 * <p>All fields are final and public for hot-path access. A "cost improvement" in the
 * frontier replaces the stored node with another instance; nodes are never mutated.
 *
 * <p>Construction does not enforce the {@code termCount} invariants; the frontier does,
 * because a violation there is an engine defect rather than a caller error.
 */
public final class ExpressionNode {

    /** Numeric result of this expression. */
    public final double value;

    /** Value of the left operand ({@code value} itself for a leaf). */
    public final double leftValue;

    /** Value of the right operand ({@code value} itself for a leaf). */
    public final double rightValue;

    /** Number of leaf literals; 1 for a leaf. */
    public final int termCount;

    /** Combination operator; {@link Operator#NONE} for a leaf. */
    public final Operator operator;

    /**
     * Constructs a node.
     *
     * @param value      the result value
     * @param leftValue  left operand value
     * @param rightValue right operand value
     * @param termCount  number of leaf literals
     * @param operator   combination operator (non-null)
     */
    public ExpressionNode(double value, double leftValue, double rightValue,
                          int termCount, Operator operator) {
        this.value = value;
        this.leftValue = leftValue;
        this.rightValue = rightValue;
        this.termCount = termCount;
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    /**
     * Creates a leaf node for a seed literal.
     *
     * @param value the literal
     * @return a node with {@code termCount = 1} and {@link Operator#NONE}
     */
    public static ExpressionNode leaf(double value) {
        return new ExpressionNode(value, value, value, 1, Operator.NONE);
    }

    /**
     * Creates a combination node from two operand nodes.
     *
     * @param value    the result of {@code left operator right}
     * @param left     left operand node
     * @param right    right operand node
     * @param operator the operator applied
     * @return a node whose cost is the sum of the operands' costs
     */
    public static ExpressionNode combine(double value, ExpressionNode left, ExpressionNode right,
                                         Operator operator) {
        return new ExpressionNode(value, left.value, right.value,
            left.termCount + right.termCount, operator);
    }

    /**
     * Returns a copy of this node with a different result value.
     *
     * <p>Used to snap a value that matched the goal within tolerance to the exact goal.
     *
     * @param newValue the replacement value
     * @return a node with the same operands, cost and operator
     */
    public ExpressionNode withValue(double newValue) {
        if (newValue == value) return this;
        return new ExpressionNode(newValue, leftValue, rightValue, termCount, operator);
    }

    /**
     * Returns whether this node is a seed literal.
     *
     * @return {@code true} if {@link #operator} is {@link Operator#NONE}
     */
    public boolean isLeaf() {
        return operator == Operator.NONE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExpressionNode)) return false;
        ExpressionNode other = (ExpressionNode) o;
        return Double.compare(value, other.value) == 0
            && Double.compare(leftValue, other.leftValue) == 0
            && Double.compare(rightValue, other.rightValue) == 0
            && termCount == other.termCount
            && operator == other.operator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, leftValue, rightValue, termCount, operator);
    }

    @Override
    public String toString() {
        if (isLeaf()) {
            return "ExpressionNode{" + value + ", leaf}";
        }
        return "ExpressionNode{" + value + " = " + leftValue + " " + operator + " " + rightValue
            + ", terms=" + termCount + "}";
    }
}
