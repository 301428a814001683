package defirange;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import defirange.intervals.Interval;
import defirange.ir.BinaryOperator;
import defirange.ir.Condition;
import defirange.ir.Constant;
import defirange.ir.Variable;

import static org.junit.jupiter.api.Assertions.*;

public class ConditionRefinerTest {

    private final AbstractState state = new AbstractState();
    private final ConditionRefiner refiner = new ConditionRefiner(state);
    private final Variable x = new Variable("x", "uint256", Variable.Kind.LOCAL);
    private final Variable y = new Variable("y", "uint256", Variable.Kind.LOCAL);

    private Interval refine(Interval initial, String operator, long constant) {
        state.set(x, initial);
        refiner.refine(new Condition(BinaryOperator.fromSymbol(operator), x, Constant.of(constant)));
        return state.get(x);
    }

    @Nested
    public class WithConstant {

        @ParameterizedTest
        @CsvSource({
                "<,10,0,9",
                "<=,10,0,10",
                ">,10,11,100",
                ">=,10,10,100",
                "==,10,10,10",
                "<,50,0,49",
                ">=,0,0,100"
        })
        public void testOperators(String operator, long constant, long low, long high) {
            assertEquals(Interval.of(low, high), refine(Interval.of(0, 100), operator, constant));
        }

        @Test
        public void testUnsatisfiable() {
            assertTrue(refine(Interval.of(0, 100), ">", 100).isBottom());
            assertTrue(refine(Interval.of(0, 100), "==", 200).isBottom());
        }

        @Test
        public void testMirroredConstant() {
            state.set(x, Interval.of(0, 100));
            refiner.refine(new Condition(BinaryOperator.LESS, Constant.of(10), x));
            assertEquals(Interval.of(11, 100), state.get(x));
        }

        @Test
        public void testUnequalsNonZeroKeepsInterval() {
            assertEquals(Interval.of(0, 100), refine(Interval.of(0, 100), "!=", 5));
        }

        @Test
        public void testUntrackedVariable() {
            refiner.refine(new Condition(BinaryOperator.LESS, y, Constant.of(10)));
            assertFalse(state.isTracked(y));
        }

        @Test
        public void testBottomStaysBottom() {
            assertTrue(refine(Interval.bottom(), "<", 10).isBottom());
        }

        @Test
        public void testNonNumericConstant() {
            state.set(x, Interval.of(0, 100));
            refiner.refine(new Condition(BinaryOperator.EQUALS, x, new Constant("\"abc\"")));
            assertEquals(Interval.of(0, 100), state.get(x));
        }
    }

    /**
     * {@code x != 0}
     */
    @Nested
    public class ExcludeZero {

        @ParameterizedTest
        @CsvSource({"0,10,1,10", "-10,0,-10,-1", "-5,5,-5,5", "3,9,3,9"})
        public void testBounds(long low, long high, long expectedLow, long expectedHigh) {
            assertEquals(Interval.of(expectedLow, expectedHigh), refine(Interval.of(low, high), "!=", 0));
        }

        @Test
        public void testZeroPoint() {
            assertTrue(refine(Interval.point(0), "!=", 0).isBottom());
        }

        @Test
        public void testBottom() {
            assertTrue(ConditionRefiner.excludeZero(Interval.bottom()).isBottom());
        }
    }

    @Nested
    public class WithVariable {

        private void refine(Interval left, BinaryOperator operator, Interval right) {
            state.set(x, left);
            state.set(y, right);
            refiner.refine(new Condition(operator, x, y));
        }

        @Test
        public void testLess() {
            refine(Interval.of(0, 10), BinaryOperator.LESS, Interval.of(3, 5));
            assertEquals(Interval.of(0, 4), state.get(x));
            assertEquals(Interval.of(3, 5), state.get(y));
        }

        @Test
        public void testGreaterEquals() {
            refine(Interval.of(0, 10), BinaryOperator.GREATER_EQUALS, Interval.of(3, 50));
            assertEquals(Interval.of(3, 10), state.get(x));
            assertEquals(Interval.of(3, 10), state.get(y));
        }

        @Test
        public void testEquals() {
            refine(Interval.of(0, 10), BinaryOperator.EQUALS, Interval.of(5, 20));
            assertEquals(Interval.of(5, 10), state.get(x));
            assertEquals(Interval.of(5, 10), state.get(y));
        }

        @Test
        public void testUnequalsIsIgnored() {
            refine(Interval.of(0, 10), BinaryOperator.UNEQUALS, Interval.point(0));
            assertEquals(Interval.of(0, 10), state.get(x));
        }

        @Test
        public void testUntrackedSide() {
            Variable z = new Variable("z", "uint256", Variable.Kind.LOCAL);
            state.set(x, Interval.of(0, 10));
            refiner.refine(new Condition(BinaryOperator.LESS, x, z));
            assertEquals(Interval.of(0, 10), state.get(x));
            assertFalse(state.isTracked(z));
        }
    }
}
