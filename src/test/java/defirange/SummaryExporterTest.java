package defirange;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import defirange.intervals.Interval;
import defirange.intervals.Intervals;
import defirange.ir.Contract;
import defirange.ir.Function;
import defirange.ir.Variable;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class SummaryExporterTest {

    private AnalysisResult result;

    @BeforeEach
    public void setUp() {
        Variable amount = new Variable("amount", "uint256", Variable.Kind.PARAMETER);
        Variable shares = new Variable("shares", "uint256", Variable.Kind.RETURN);
        Variable memo = new Variable("memo", "string", Variable.Kind.PARAMETER);
        Function deposit = new Function("deposit").addParameter(amount).addParameter(memo).addReturn(shares);
        new Contract("Vault").addFunction(deposit);
        AbstractState state = new AbstractState();
        state.set(amount, Intervals.UINT256);
        state.set(shares, Interval.of(0, 1000));
        result = new AnalysisResult();
        result.add(FunctionSummary.of(deposit, state), List.of(new Violation(Violation.Kind.MAX_BOUND,
                new Violation.Location("Vault", "deposit", "shares"), "shares <too> large", Interval.of(0, 1000), false)));
        result.skip("Vault.broken", "Malformed control flow graph of Vault.broken: null node");
    }

    @Test
    public void testExport() {
        Map<String, Map<String, Map<String, String>>> export = SummaryExporter.export(result);
        assertThat(export.keySet()).containsExactly("Vault.deposit");
        Map<String, Map<String, String>> deposit = export.get("Vault.deposit");
        assertThat(deposit.keySet()).containsExactly("params", "returns").inOrder();
        assertThat(deposit.get("params").keySet()).containsExactly("amount", "memo").inOrder();
        assertEquals("⊥", deposit.get("params").get("memo"));
        assertEquals("[0, 1000]", deposit.get("returns").get("shares"));
    }

    @Test
    public void testJson() {
        JsonObject json = JsonParser.parseString(SummaryExporter.toJson(result)).getAsJsonObject();
        JsonArray violations = json.getAsJsonArray("violations");
        assertEquals(1, violations.size());
        JsonObject violation = violations.get(0).getAsJsonObject();
        assertEquals("MAX_BOUND", violation.get("kind").getAsString());
        assertEquals("Vault", violation.get("contract").getAsString());
        assertEquals("deposit", violation.get("function").getAsString());
        assertEquals("shares", violation.get("variable").getAsString());
        assertFalse(violation.get("standalone").getAsBoolean());
        assertEquals("[0, 1000]", json.getAsJsonObject("summaries").getAsJsonObject("Vault.deposit")
                .getAsJsonObject("returns").get("shares").getAsString());
        JsonObject skipped = json.getAsJsonArray("skipped").get(0).getAsJsonObject();
        assertEquals("Vault.broken", skipped.get("function").getAsString());
    }

    @Test
    public void testNoHtmlEscaping() {
        assertThat(SummaryExporter.toJson(result)).contains("shares <too> large");
    }

    @Test
    public void testEmptyResult() {
        JsonObject json = SummaryExporter.toJsonTree(new AnalysisResult());
        assertEquals(0, json.getAsJsonArray("violations").size());
        assertEquals(0, json.getAsJsonObject("summaries").size());
        assertEquals(0, json.getAsJsonArray("skipped").size());
    }
}
