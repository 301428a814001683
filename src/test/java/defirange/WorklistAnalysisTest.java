package defirange;

import java.math.BigInteger;
import java.time.Duration;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import defirange.intervals.Interval;
import defirange.intervals.Intervals;
import defirange.ir.Function;
import defirange.ir.IrReader;
import defirange.ir.Program;
import defirange.ir.Variable;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class WorklistAnalysisTest {

    static final String LOOP = String.join("\n",
            "contract Counter",
            "  function loop",
            "    local uint256 i",
            "    node 0 -> 1",
            "      i = 0",
            "    node 1 -> 1, 2",
            "      i = i + 1",
            "    node 2");

    static Function function(String program, String name) {
        Program parsed = IrReader.parse(program);
        return parsed.function(name).get();
    }

    static Variable variable(WorklistAnalysis analysis, String name) {
        return analysis.state().variables().stream().filter(v -> v.name.equals(name)).findFirst().get();
    }

    private static WorklistAnalysis analyse(Function function, String options) {
        WorklistAnalysis analysis = new WorklistAnalysis(function, AnalysisConfig.defaults().withOptions(options));
        analysis.run();
        return analysis;
    }

    @Nested
    public class SelfLoop {

        @Test
        public void testTerminates() {
            WorklistAnalysis analysis = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> analyse(function(LOOP, "Counter.loop"), ""));
            assertEquals(WorklistAnalysis.Phase.DONE, analysis.phase());
            assertEquals(4, analysis.iterations());
            assertEquals(4, analysis.visits().get(1).intValue());
            assertEquals(1, analysis.visits().get(0).intValue());
        }

        @Test
        public void testWidenedWithoutNarrowing() {
            WorklistAnalysis analysis = analyse(function(LOOP, "Counter.loop"), "narrow=0");
            assertEquals(Interval.atLeast(BigInteger.valueOf(2)), analysis.state().get(variable(analysis, "i")));
        }

        @Test
        public void testNarrowingRecoversFiniteBound() {
            WorklistAnalysis analysis = analyse(function(LOOP, "Counter.loop"), "");
            Interval i = analysis.state().get(variable(analysis, "i"));
            assertTrue(i.isFinite());
            assertEquals(Interval.point(1), i);
        }

        @Test
        public void testWidenedIncrementOverflows() {
            WorklistAnalysis analysis = analyse(function(LOOP, "Counter.loop"), "");
            assertThat(analysis.candidates().violations()).hasSize(1);
            assertEquals(Violation.Kind.OVERFLOW, analysis.candidates().violations().get(0).kind);
        }

        @ParameterizedTest
        @ValueSource(ints = {1, 2, 5, 10})
        public void testTerminatesForAllThresholds(int threshold) {
            WorklistAnalysis analysis = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> analyse(function(LOOP, "Counter.loop"), "widen=" + threshold + ";maxiter=1000"));
            assertThat(analysis.iterations()).isLessThan(1000);
        }

        @Test
        public void testIterationCap() {
            WorklistAnalysis analysis = analyse(function(LOOP, "Counter.loop"), "maxiter=1");
            assertEquals(1, analysis.iterations());
            assertEquals(WorklistAnalysis.Phase.DONE, analysis.phase());
        }

        @Test
        public void testBatchSizeOne() {
            WorklistAnalysis analysis = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> analyse(function(LOOP, "Counter.loop"), "batch=1;maxiter=100"));
            assertThat(analysis.iterations()).isLessThan(100);
        }
    }

    @Test
    public void testRunsOnce() {
        WorklistAnalysis analysis = new WorklistAnalysis(function(LOOP, "Counter.loop"), AnalysisConfig.defaults());
        assertEquals(WorklistAnalysis.Phase.INITIALIZING, analysis.phase());
        analysis.run();
        assertThrows(IllegalStateException.class, analysis::run);
    }

    @Nested
    public class Seeding {

        static final String PROGRAM = "contract Vault\n"
                + "  state uint256 totalDeposits\n"
                + "  state uint256 unused\n"
                + "  function deposit\n"
                + "    param uint256 amount\n"
                + "    param string memo\n"
                + "    local uint256 total\n"
                + "    local string label\n"
                + "    node 0\n"
                + "      total = totalDeposits\n"
                + "      label = memo\n";

        private WorklistAnalysis seeded(boolean seedLocals) {
            Function deposit = function(PROGRAM, "Vault.deposit");
            WorklistAnalysis analysis = new WorklistAnalysis(deposit,
                    AnalysisConfig.builder().seedLocals(seedLocals).build());
            analysis.seed();
            return analysis;
        }

        private boolean tracked(WorklistAnalysis analysis, String name) {
            return analysis.state().variables().stream().anyMatch(v -> v.name.equals(name));
        }

        @Test
        public void testCriticalParametersAndUsedState() {
            WorklistAnalysis analysis = seeded(true);
            assertTrue(tracked(analysis, "amount"));
            assertTrue(tracked(analysis, "totalDeposits"));
            assertTrue(tracked(analysis, "total"));
            assertFalse(tracked(analysis, "memo"));
            assertFalse(tracked(analysis, "label"));
            assertFalse(tracked(analysis, "unused"));
            assertEquals(Intervals.UINT256, analysis.state().get(variable(analysis, "amount")));
        }

        @Test
        public void testWithoutLocals() {
            WorklistAnalysis analysis = seeded(false);
            assertTrue(tracked(analysis, "amount"));
            assertFalse(tracked(analysis, "total"));
        }
    }

    @Test
    public void testBranchRefinement() {
        String program = "contract Vault\n"
                + "  state uint256 leverage_ratio\n"
                + "  function setLeverage\n"
                + "    param uint256 requested\n"
                + "    node 0 -> 1, 2\n"
                + "      if requested <= 500\n"
                + "    node 1\n"
                + "      leverage_ratio = requested\n"
                + "    node 2\n";
        WorklistAnalysis analysis = analyse(function(program, "Vault.setLeverage"), "");
        assertEquals(Interval.of(0, 500), analysis.state().get(variable(analysis, "leverage_ratio")));
    }

    @Test
    public void testSafeMathTargetIsVerified() {
        String program = "contract Vault\n"
                + "  state uint256 totalDeposits\n"
                + "  function safeDeposit\n"
                + "    param uint256 amount\n"
                + "    temp uint256 sum\n"
                + "    node 0\n"
                + "      sum = call SafeMath.add(totalDeposits, amount) : uint256\n"
                + "      totalDeposits = sum\n";
        WorklistAnalysis analysis = analyse(function(program, "Vault.safeDeposit"), "");
        assertThat(analysis.libraryVerified()).contains(variable(analysis, "sum"));
        assertTrue(analysis.candidates().isEmpty());
    }

    @Test
    public void testEmptyFunction() {
        WorklistAnalysis analysis = analyse(function("contract C\n function f\n", "C.f"), "");
        assertEquals(0, analysis.state().size());
        assertEquals(0, analysis.iterations());
    }
}
