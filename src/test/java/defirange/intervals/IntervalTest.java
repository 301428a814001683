package defirange.intervals;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static com.google.common.truth.Truth.assertThat;
import static defirange.intervals.ExtendedInteger.NEGATIVE_INFINITY;
import static defirange.intervals.ExtendedInteger.POSITIVE_INFINITY;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Lattice laws and the widening and narrowing operators of the interval domain
 */
public class IntervalTest {

    static final List<Interval> SAMPLES = List.of(
            Interval.bottom(),
            Interval.top(),
            Interval.point(0),
            Interval.point(-3),
            Interval.of(0, 10),
            Interval.of(-5, 5),
            Interval.of(7, 100),
            Interval.atMost(BigInteger.valueOf(4)),
            Interval.atLeast(BigInteger.valueOf(-2)),
            Intervals.UINT256,
            Intervals.MACHINE);

    static Stream<Arguments> pairs() {
        return SAMPLES.stream().flatMap(a -> SAMPLES.stream().map(b -> Arguments.of(a, b)));
    }

    static Stream<Arguments> triples() {
        return SAMPLES.stream().flatMap(a -> SAMPLES.stream().flatMap(b -> SAMPLES.stream().map(c -> Arguments.of(a, b, c))));
    }

    static Stream<Interval> samples() {
        return SAMPLES.stream();
    }

    @Nested
    public class LatticeLaws {

        @ParameterizedTest
        @MethodSource("defirange.intervals.IntervalTest#pairs")
        public void testCommutativity(Interval a, Interval b) {
            assertEquals(a.join(b), b.join(a));
            assertEquals(a.meet(b), b.meet(a));
        }

        @ParameterizedTest
        @MethodSource("defirange.intervals.IntervalTest#triples")
        public void testAssociativity(Interval a, Interval b, Interval c) {
            assertEquals(a.join(b).join(c), a.join(b.join(c)));
            assertEquals(a.meet(b).meet(c), a.meet(b.meet(c)));
        }

        @ParameterizedTest
        @MethodSource("defirange.intervals.IntervalTest#samples")
        public void testIdentities(Interval a) {
            assertEquals(a, a.meet(a));
            assertEquals(a, a.join(a));
            assertEquals(a, Interval.bottom().join(a));
            assertEquals(a, Interval.top().meet(a));
            assertTrue(Interval.bottom().isSubsetOf(a));
            assertTrue(a.isSubsetOf(Interval.top()));
        }

        @ParameterizedTest
        @MethodSource("defirange.intervals.IntervalTest#pairs")
        public void testJoinAndMeetBounds(Interval a, Interval b) {
            assertTrue(a.isSubsetOf(a.join(b)));
            assertTrue(b.isSubsetOf(a.join(b)));
            assertTrue(a.meet(b).isSubsetOf(a));
            assertTrue(a.meet(b).isSubsetOf(b));
        }
    }

    @Test
    public void testTopJoin() {
        assertTrue(Interval.top().join(Interval.of(1, 2)).isTop());
        assertTrue(Interval.of(1, 2).join(Interval.top()).isTop());
    }

    @Test
    public void testEmptyMeet() {
        assertTrue(Interval.of(0, 3).meet(Interval.of(4, 9)).isBottom());
    }

    @Test
    public void testInvertedBoundsAreBottom() {
        assertTrue(Interval.of(5, 4).isBottom());
        assertEquals("⊥", Interval.of(5, 4).toString());
    }

    @Test
    public void testBottomHasNoBounds() {
        assertThrows(IllegalStateException.class, () -> Interval.bottom().lower());
        assertThrows(IllegalStateException.class, () -> Interval.bottom().upper());
    }

    @Test
    public void testToString() {
        assertEquals("⊤", Interval.top().toString());
        assertEquals("[1, 2]", Interval.of(1, 2).toString());
        assertEquals("[-∞, 4]", Interval.atMost(BigInteger.valueOf(4)).toString());
        assertEquals("[0, +∞]", Interval.atLeast(BigInteger.ZERO).toString());
    }

    @Nested
    public class Widening {

        @Test
        public void testGrowingUpperBound() {
            assertEquals(Interval.atLeast(BigInteger.ZERO), Interval.of(0, 1).widen(Interval.of(0, 2)));
        }

        @Test
        public void testGrowingLowerBound() {
            assertEquals(Interval.atMost(BigInteger.TEN), Interval.of(0, 10).widen(Interval.of(-1, 5)));
        }

        @Test
        public void testStableBounds() {
            assertEquals(Interval.of(0, 10), Interval.of(0, 10).widen(Interval.of(2, 8)));
        }

        @Test
        public void testBottom() {
            assertEquals(Interval.of(1, 2), Interval.bottom().widen(Interval.of(1, 2)));
            assertEquals(Interval.of(1, 2), Interval.of(1, 2).widen(Interval.bottom()));
        }

        @ParameterizedTest
        @MethodSource("defirange.intervals.IntervalTest#pairs")
        public void testNeverLosesValues(Interval a, Interval b) {
            assertTrue(a.isSubsetOf(a.widen(b)));
        }
    }

    @Nested
    public class Narrowing {

        @Test
        public void testReplacesInfiniteBounds() {
            assertEquals(Interval.of(0, 10), Interval.atLeast(BigInteger.ZERO).narrow(Interval.of(3, 10)));
            assertEquals(Interval.of(-4, 7), Interval.atMost(BigInteger.valueOf(7)).narrow(Interval.of(-4, 0)));
        }

        @Test
        public void testKeepsFiniteBounds() {
            assertEquals(Interval.of(0, 10), Interval.of(0, 10).narrow(Interval.of(3, 5)));
        }

        @ParameterizedTest
        @MethodSource("defirange.intervals.IntervalTest#pairs")
        public void testIntroducesOnlyKnownBounds(Interval a, Interval b) {
            Interval narrowed = a.narrow(b);
            if (narrowed.isBottom()) {
                return;
            }
            assertThat(List.of(a.lower(), b.lower())).contains(narrowed.lower());
            assertThat(List.of(a.upper(), b.upper())).contains(narrowed.upper());
        }
    }

    @Test
    public void testContains() {
        Interval interval = Interval.of(-5, 5);
        assertTrue(interval.containsZero());
        assertTrue(interval.contains(BigInteger.valueOf(5)));
        assertFalse(interval.contains(BigInteger.valueOf(6)));
        assertFalse(Interval.bottom().containsZero());
        assertTrue(Interval.top().contains(Intervals.MACHINE_CEILING.pow(2)));
    }

    @Test
    public void testInfiniteBounds() {
        Interval interval = Interval.of(NEGATIVE_INFINITY, POSITIVE_INFINITY);
        assertTrue(interval.isTop());
        assertFalse(interval.isFinite());
        assertTrue(Interval.of(1, 2).isFinite());
    }
}
