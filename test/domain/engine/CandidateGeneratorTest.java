package domain.engine;

import domain.model.ExpressionNode;
import domain.model.NumericDomain;
import domain.model.Operator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CandidateGeneratorTest {

    private static final EnumSet<Operator> ALL =
        EnumSet.of(Operator.ADD, Operator.SUB, Operator.MUL, Operator.DIV);

    private static List<ExpressionNode> generate(CandidateGenerator generator, ExpressionNode a, ExpressionNode b) {
        List<ExpressionNode> out = new ArrayList<>();
        generator.generate(a, b, out::add);
        return out;
    }

    private static List<Double> values(List<ExpressionNode> nodes) {
        List<Double> values = new ArrayList<>();
        for (ExpressionNode node : nodes) {
            values.add(node.value);
        }
        return values;
    }

    @Test
    void integerCandidatesSkipInexactDivision() {
        CandidateGenerator generator = new CandidateGenerator(NumericDomain.INTEGER, ALL);
        List<ExpressionNode> out = generate(generator, ExpressionNode.leaf(3), ExpressionNode.leaf(4));

        assertEquals(List.of(-1.0, 12.0, 7.0, 1.0), values(out));
        assertEquals(Operator.SUB, out.get(0).operator);
        assertEquals(Operator.MUL, out.get(1).operator);
        assertEquals(Operator.ADD, out.get(2).operator);
        assertEquals(Operator.SUB, out.get(3).operator);
        assertEquals(4.0, out.get(3).leftValue);
        assertEquals(3.0, out.get(3).rightValue);
        for (ExpressionNode node : out) {
            assertEquals(2, node.termCount);
        }
    }

    @Test
    void exactDivisionComesFirst() {
        CandidateGenerator generator = new CandidateGenerator(NumericDomain.INTEGER, ALL);
        List<ExpressionNode> out = generate(generator, ExpressionNode.leaf(4), ExpressionNode.leaf(2));

        assertEquals(List.of(2.0, 2.0, 8.0, 6.0, -2.0), values(out));
        assertEquals(Operator.DIV, out.get(0).operator);
    }

    @Test
    void sameValueProducesNoSwappedCandidates() {
        CandidateGenerator generator = new CandidateGenerator(NumericDomain.INTEGER, ALL);
        ExpressionNode three = ExpressionNode.leaf(3);

        assertEquals(List.of(1.0, 0.0, 9.0, 6.0), values(generate(generator, three, three)));
    }

    @Test
    void realDomainDividesBothWays() {
        CandidateGenerator generator = new CandidateGenerator(NumericDomain.REAL, ALL);
        List<ExpressionNode> out = generate(generator, ExpressionNode.leaf(3), ExpressionNode.leaf(4));

        assertEquals(List.of(0.75, -1.0, 12.0, 7.0, 4.0 / 3.0, 1.0), values(out));
    }

    @Test
    void divisionByZeroIsNeverProduced() {
        CandidateGenerator generator = new CandidateGenerator(NumericDomain.REAL, EnumSet.of(Operator.DIV));
        ExpressionNode zero = new ExpressionNode(0, 3, 3, 2, Operator.SUB);

        List<ExpressionNode> out = generate(generator, ExpressionNode.leaf(5), zero);

        assertEquals(List.of(0.0), values(out));
        assertEquals(3, out.get(0).termCount);
    }

    @Test
    void operatorSetFiltersCandidates() {
        CandidateGenerator generator = new CandidateGenerator(NumericDomain.INTEGER, EnumSet.of(Operator.ADD));

        assertEquals(List.of(7.0), values(generate(generator, ExpressionNode.leaf(3), ExpressionNode.leaf(4))));
    }

    @Test
    void negativeZeroIsCanonicalized() {
        CandidateGenerator generator = new CandidateGenerator(NumericDomain.INTEGER, EnumSet.of(Operator.MUL));
        ExpressionNode zero = new ExpressionNode(0, 3, 3, 2, Operator.SUB);

        List<ExpressionNode> out = generate(generator, zero, ExpressionNode.leaf(-3));

        assertEquals(1, out.size());
        assertEquals(0, Double.compare(0.0, out.get(0).value));
    }

    @Test
    void costBelowTwoThrows() {
        CandidateGenerator generator = new CandidateGenerator(NumericDomain.INTEGER, ALL);
        ExpressionNode broken = new ExpressionNode(5, 5, 5, 0, Operator.NONE);

        assertThrows(SearchInvariantException.class,
            () -> generator.generate(broken, ExpressionNode.leaf(1), node -> { }));
    }
}
