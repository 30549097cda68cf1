package domain.engine;

import domain.model.ExpressionNode;
import domain.model.NumericDomain;
import domain.model.Operator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExpressionRendererTest {

    private SearchState state;
    private ExpressionRenderer renderer;

    @BeforeEach
    void setUp() {
        state = new SearchState(new IndexedHeapFrontier(), 10, 20);
        ClosedStore closed = state.getClosed();
        ExpressionNode three = ExpressionNode.leaf(3);
        ExpressionNode one = ExpressionNode.combine(1, three, three, Operator.DIV);
        ExpressionNode nine = ExpressionNode.combine(9, three, three, Operator.MUL);
        closed.settle(three);
        closed.settle(one);
        closed.settle(nine);
        // Goal witness still open
        state.getFrontier().insertOrImprove(ExpressionNode.combine(10, nine, one, Operator.ADD));

        renderer = new ExpressionRenderer(state, NumericDomain.INTEGER);
    }

    @Test
    void rendersLeafAsLiteral() {
        assertEquals("3", renderer.renderInfix(3));
        assertEquals(List.of("3"), renderer.renderPostfix(3));
    }

    @Test
    void rendersFullyParenthesizedInfix() {
        assertEquals("((3*3)+(3/3))", renderer.renderInfix(10));
    }

    @Test
    void postfixEvaluatesToTheValue() {
        List<String> postfix = renderer.renderPostfix(10);

        assertEquals(List.of("3", "3", "*", "3", "3", "/", "+"), postfix);
        assertEquals(10.0, PostfixEvaluator.evaluate(postfix));
        assertEquals(4, PostfixEvaluator.countLiterals(postfix));
    }

    @Test
    void unknownValueThrows() {
        assertThrows(SearchInvariantException.class, () -> renderer.renderInfix(42));
    }

    @Test
    void danglingOperandThrows() {
        state.getFrontier().insertOrImprove(new ExpressionNode(50, 10, 5, 5, Operator.MUL));
        assertThrows(SearchInvariantException.class, () -> renderer.renderPostfix(50));
    }

    @Test
    void symbols() {
        assertEquals("+", ExpressionRenderer.symbol(Operator.ADD));
        assertEquals("-", ExpressionRenderer.symbol(Operator.SUB));
        assertEquals("*", ExpressionRenderer.symbol(Operator.MUL));
        assertEquals("/", ExpressionRenderer.symbol(Operator.DIV));
        assertThrows(IllegalArgumentException.class, () -> ExpressionRenderer.symbol(Operator.NONE));
    }
}
