package defirange;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import picocli.CommandLine;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private String vault;

    @BeforeEach
    public void setUp() throws URISyntaxException {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        vault = Paths.get(MainTest.class.getResource("/vault.ir").toURI()).toString();
    }

    private int run(String... args) {
        return new CommandLine(new Main(new PrintStream(out, true), new PrintStream(err, true))).execute(args);
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testViolations() {
        assertEquals(0, run(vault));
        assertThat(out()).contains("underflow at Vault.withdraw:balance");
        assertThat(out()).contains("division by zero at Vault.exchangeRate:rate");
        assertThat(out()).contains("maximum bound violation at Vault.setLeverage:leverage_ratio");
        assertThat(out()).doesNotContain("Greeter");
    }

    @Test
    public void testSummary() {
        assertEquals(0, run("--summary", vault));
        assertThat(out()).startsWith("7 violations");
        assertThat(out()).containsMatch("underflow\\W+3\\b");
        assertThat(out()).containsMatch("Vault\\W+7\\b");
    }

    @Test
    public void testAll() {
        assertEquals(0, run("--all", "--summary", vault));
        assertThat(out()).containsMatch("Greeter\\W+2\\b");
    }

    @Test
    public void testDebugLogging() {
        assertEquals(0, run("--debug", vault));
        assertThat(err()).contains("Analysed Vault.withdraw in");
        assertEquals(Level.INFO, RangeAnalyzer.LOG.getLevel());
        assertTrue(RangeAnalyzer.LOG.getUseParentHandlers());
        assertThat(RangeAnalyzer.LOG.getHandlers()).isEmpty();
    }

    @Test
    public void testNoDebugLoggingByDefault() {
        assertEquals(0, run(vault));
        assertThat(err()).doesNotContain("Analysed Vault.withdraw in");
    }

    @Test
    public void testFunctions() {
        assertEquals(0, run("--functions", vault));
        assertThat(out()).contains("Vault.setLeverage(requested: [0, 500]) returns ()");
    }

    @Test
    public void testCustomConstraint() {
        assertEquals(0, run("--summary", "--constraint", "requested=1:10^3", vault));
        assertThat(out()).startsWith("8 violations");
    }

    @Test
    public void testJson(@TempDir Path dir) throws IOException {
        Path json = dir.resolve("report.json");
        assertEquals(0, run("--json", json.toString(), vault));
        JsonObject report = JsonParser.parseString(new String(Files.readAllBytes(json), StandardCharsets.UTF_8)).getAsJsonObject();
        assertEquals(7, report.getAsJsonArray("violations").size());
        assertEquals("[0, 500]", report.getAsJsonObject("summaries").getAsJsonObject("Vault.setLeverage")
                .getAsJsonObject("params").get("requested").getAsString());
    }

    @Test
    public void testMissingFile() {
        assertEquals(1, run("does/not/exist.ir"));
        assertThat(err()).contains("does/not/exist.ir");
    }

    @ParameterizedTest
    @ValueSource(strings = {"--constraint=fee", "--constraint=fee=5:1", "--options=widen=0", "--options=unknown=1", "--options=widen=x"})
    public void testInvalidConfiguration(String option) {
        assertEquals(1, run(option, vault));
        assertThat(err()).isNotEmpty();
    }

    @Test
    public void testInvalidProgram(@TempDir Path dir) throws IOException {
        Path program = dir.resolve("broken.ir");
        Files.write(program, "contract C\nfunction f\nnode 0 -> 3\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(1, run(program.toString()));
        assertThat(err()).startsWith("Line 3: ");
    }

    @Test
    public void testConfig() {
        Main main = new Main();
        new CommandLine(main).parseArgs("--all", "--options", "widen=5;threads=2", "--constraint", "cooldown=60:86400", vault);
        AnalysisConfig config = main.config();
        assertFalse(config.relevanceFilter);
        assertEquals(5, config.wideningThreshold);
        assertEquals(2, config.threads);
        assertThat(config.constraints).contains(new DomainConstraint("cooldown", 60, 86400));
    }
}
