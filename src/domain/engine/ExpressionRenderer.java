package domain.engine;

import domain.model.ExpressionNode;
import domain.model.NumericDomain;
import domain.model.Operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds an expression by following value-keyed operand references.
 *
 * <p>Two equivalent views of the same node structure:
 * <ul>
 *   <li><b>Infix</b>: every combination fully parenthesized: {@code ((42+42)*42)}</li>
 *   <li><b>Postfix</b>: RPN tokens: {@code 42 42 + 42 *}</li>
 * </ul>
 * Both contain exactly {@code termCount} literals of the rendered node.
 *
 * <p>Lookups go to the settled store first and then to the frontier, so a goal witness
 * can be rendered before it is settled. Operands of any stored node are always settled.
 *
 * <p>Rendering recurses once per operator; depth is bounded by the term count, which stays
 * in the tens for realistic goals. {@link #MAX_DEPTH} guards against corrupted references.
 */
public final class ExpressionRenderer {

    /** Recursion guard; far above any term count the search can reach in practice. */
    static final int MAX_DEPTH = 10_000;

    private static final Map<Operator, String> SYMBOLS = new EnumMap<>(Operator.class);

    static {
        SYMBOLS.put(Operator.ADD, "+");
        SYMBOLS.put(Operator.SUB, "-");
        SYMBOLS.put(Operator.MUL, "*");
        SYMBOLS.put(Operator.DIV, "/");
    }

    private final SearchState state;
    private final NumericDomain domain;

    public ExpressionRenderer(SearchState state, NumericDomain domain) {
        this.state = state;
        this.domain = domain;
    }

    /**
     * Returns the display symbol of an operator.
     *
     * @param operator a combination operator
     * @return {@code +}, {@code -}, {@code *} or {@code /}
     * @throws IllegalArgumentException for {@link Operator#NONE}
     */
    public static String symbol(Operator operator) {
        String symbol = SYMBOLS.get(operator);
        if (symbol == null) {
            throw new IllegalArgumentException("No symbol for " + operator);
        }
        return symbol;
    }

    /**
     * Renders the best known expression for a value in fully parenthesized infix form.
     *
     * @param value a settled or open value
     * @return the infix expression
     * @throws SearchInvariantException if the value or one of its operands is unknown
     */
    public String renderInfix(double value) {
        StringBuilder sb = new StringBuilder();
        appendInfix(value, sb, 0);
        return sb.toString();
    }

    /**
     * Renders the best known expression for a value as postfix tokens.
     *
     * @param value a settled or open value
     * @return read-only token list
     * @throws SearchInvariantException if the value or one of its operands is unknown
     */
    public List<String> renderPostfix(double value) {
        List<String> tokens = new ArrayList<>();
        appendPostfix(value, tokens, 0);
        return Collections.unmodifiableList(tokens);
    }

    private void appendInfix(double value, StringBuilder sb, int depth) {
        ExpressionNode node = resolve(value, depth);
        if (node.isLeaf()) {
            sb.append(domain.format(node.value));
            return;
        }
        sb.append('(');
        appendInfix(node.leftValue, sb, depth + 1);
        sb.append(symbol(node.operator));
        appendInfix(node.rightValue, sb, depth + 1);
        sb.append(')');
    }

    private void appendPostfix(double value, List<String> tokens, int depth) {
        ExpressionNode node = resolve(value, depth);
        if (node.isLeaf()) {
            tokens.add(domain.format(node.value));
            return;
        }
        appendPostfix(node.leftValue, tokens, depth + 1);
        appendPostfix(node.rightValue, tokens, depth + 1);
        tokens.add(symbol(node.operator));
    }

    private ExpressionNode resolve(double value, int depth) {
        if (depth > MAX_DEPTH) {
            throw new SearchInvariantException("Expression deeper than " + MAX_DEPTH + " at value " + value);
        }
        ExpressionNode node = state.lookupBestKnown(value);
        if (node == null) {
            throw new SearchInvariantException("Dangling operand reference: " + value);
        }
        return node;
    }
}
