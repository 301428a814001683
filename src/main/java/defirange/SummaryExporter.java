package defirange;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import defirange.intervals.Interval;
import defirange.ir.Variable;

/**
 * Exports the results as plain maps and as a JSON report
 */
public class SummaryExporter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    /**
     * {@code Contract.function -> {"params": {name -> interval}, "returns": {name -> interval}}}
     */
    public static Map<String, Map<String, Map<String, String>>> export(AnalysisResult result) {
        Map<String, Map<String, Map<String, String>>> export = new LinkedHashMap<>();
        result.summaries().forEach((name, summary) -> export.put(name, export(summary)));
        return export;
    }

    public static Map<String, Map<String, String>> export(FunctionSummary summary) {
        Map<String, Map<String, String>> export = new LinkedHashMap<>();
        export.put("params", texts(summary.parameters()));
        export.put("returns", texts(summary.returns()));
        return export;
    }

    private static Map<String, String> texts(Map<Variable, Interval> intervals) {
        Map<String, String> texts = new LinkedHashMap<>();
        intervals.forEach((v, i) -> texts.put(v.name, i.toString()));
        return texts;
    }

    public static JsonObject toJsonTree(AnalysisResult result) {
        JsonObject root = new JsonObject();
        JsonArray violations = new JsonArray();
        for (Violation violation : result.violations()) {
            JsonObject object = new JsonObject();
            object.addProperty("kind", violation.kind.name());
            object.addProperty("contract", violation.location.contract);
            object.addProperty("function", violation.location.function);
            object.addProperty("variable", violation.location.variable);
            object.addProperty("message", violation.message);
            object.addProperty("interval", violation.intervalText());
            object.addProperty("standalone", violation.standalone);
            violations.add(object);
        }
        root.add("violations", violations);
        root.add("summaries", GSON.toJsonTree(export(result)));
        JsonArray skipped = new JsonArray();
        for (AnalysisResult.Skipped skip : result.skipped()) {
            JsonObject object = new JsonObject();
            object.addProperty("function", skip.function);
            object.addProperty("reason", skip.reason);
            skipped.add(object);
        }
        root.add("skipped", skipped);
        return root;
    }

    public static String toJson(AnalysisResult result) {
        return GSON.toJson(toJsonTree(result));
    }
}
