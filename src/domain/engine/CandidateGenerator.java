package domain.engine;

import domain.model.ExpressionNode;
import domain.model.NumericDomain;
import domain.model.Operator;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Combines two settled nodes into every new candidate expression.
 *
 * <p>For operands {@code a} and {@code b} (possibly the same node) the candidates are, in
 * order: {@code a/b} when the numeric domain accepts the quotient, {@code a-b},
 * {@code a*b}, {@code a+b}; then, if the values differ, {@code b/a} and {@code b-a}.
 * Addition and multiplication are commutative and are produced once.
 *
 * <p>Every candidate costs {@code a.termCount + b.termCount} and is handed to the sink
 * as soon as it is built. Result values are canonical (no negative zero).
 */
public final class CandidateGenerator {

    private final NumericDomain domain;
    private final Set<Operator> operators;

    /**
     * Constructs a generator.
     *
     * @param domain    numeric domain deciding division validity
     * @param operators operators allowed in candidates ({@link Operator#NONE} is ignored)
     */
    public CandidateGenerator(NumericDomain domain, Set<Operator> operators) {
        this.domain = domain;
        this.operators = operators.isEmpty() ? EnumSet.noneOf(Operator.class) : EnumSet.copyOf(operators);
        this.operators.remove(Operator.NONE);
    }

    /**
     * Produces all candidates combining {@code a} and {@code b}.
     *
     * @param a    first settled node
     * @param b    second settled node
     * @param sink receives each candidate immediately
     * @throws SearchInvariantException if the combined cost is below 2
     */
    public void generate(ExpressionNode a, ExpressionNode b, Consumer<ExpressionNode> sink) {
        int cost = a.termCount + b.termCount;
        if (cost < 2) {
            throw new SearchInvariantException("Combination cost below 2: " + a + " with " + b);
        }

        emitDivision(a, b, sink);
        emit(Operator.SUB, a, b, sink);
        emit(Operator.MUL, a, b, sink);
        emit(Operator.ADD, a, b, sink);

        if (Double.compare(a.value, b.value) != 0) {
            emitDivision(b, a, sink);
            emit(Operator.SUB, b, a, sink);
        }
    }

    private void emitDivision(ExpressionNode left, ExpressionNode right, Consumer<ExpressionNode> sink) {
        if (domain.isDivisionValid(left.value, right.value)) {
            emit(Operator.DIV, left, right, sink);
        }
    }

    private void emit(Operator operator, ExpressionNode left, ExpressionNode right,
                      Consumer<ExpressionNode> sink) {
        if (!operators.contains(operator)) return;
        double result = domain.canonical(operator.apply(left.value, right.value));
        sink.accept(ExpressionNode.combine(result, left, right, operator));
    }

    public NumericDomain getDomain() {
        return domain;
    }
}
