package defirange;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;
import java.util.stream.Collectors;

import de.vandermeer.asciitable.AsciiTable;
import de.vandermeer.asciithemes.TA_GridThemes;
import de.vandermeer.skb.interfaces.transformers.textformat.TextAlignment;
import defirange.ir.IrReader;
import defirange.ir.Program;
import picocli.CommandLine;

import static picocli.CommandLine.*;

/**
 * Runs the analysis on the command line
 */
@Command(description = "Interval range analysis of smart contract functions. Reports possible overflows, " +
        "underflows, divisions by zero and violated DeFi domain bounds.",
        showDefaultValues = true, mixinStandardHelpOptions = true, name = "defirange")
public class Main implements Callable<Integer> {

    @Parameters(description = "program file in the IR text form to analyze, or '-' to read from standard in",
            defaultValue = "-")
    private String programPath = "-";

    @Option(names = "--json", description = "write the violations and function summaries as JSON to this file")
    private Path jsonPath;

    @Option(names = "--summary", description = "only print the number of violations per kind and per contract")
    private boolean summary;

    @Option(names = "--functions", description = "print the intervals of the parameters and return values")
    private boolean functions;

    @Option(names = "--debug", description = "log the progress of the fixpoint iteration")
    private boolean debug;

    @Option(names = "--all", description = "analyze all contracts, not only the ones that look like DeFi contracts")
    private boolean all;

    @Option(names = "--options", description = "analysis options, e.g. 'widen=3;narrow=2;maxiter=20;batch=5;tolerance=0;threads=1'")
    private String options = "";

    @Option(names = "--constraint", description = "domain constraint 'keyword=min:max', bounds like 10^18 or 2^256-1 are allowed")
    private List<String> constraints = new ArrayList<>();

    private final PrintStream out;
    private final PrintStream err;

    public Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public Main() {
        this(System.out, System.err);
    }

    @Override
    public Integer call() {
        Handler debugHandler = debug ? enableDebugLogging() : null;
        try {
            AnalysisConfig config = config();
            Program program = programPath.equals("-") ?
                    IrReader.parse(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))
                            .lines().collect(Collectors.joining("\n"))) :
                    IrReader.read(Paths.get(programPath));
            AnalysisResult result = new RangeAnalyzer(config).analyze(program);
            print(result);
            if (jsonPath != null) {
                Files.write(jsonPath, SummaryExporter.toJson(result).getBytes(StandardCharsets.UTF_8));
            }
            return 0;
        } catch (IOException e) {
            err.println("Cannot access " + e.getMessage());
            return 1;
        } catch (RangeAnalysisError e) {
            err.println(e.getMessage());
            return 1;
        } finally {
            if (debugHandler != null) {
                disableDebugLogging(debugHandler);
            }
        }
    }

    /**
     * Sends the FINE records of the "Analysis" logger to the error stream, the parent handlers
     * only pass INFO and above
     */
    private Handler enableDebugLogging() {
        Handler handler = new StreamHandler(err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        handler.setLevel(Level.FINE);
        RangeAnalyzer.LOG.setLevel(Level.FINE);
        RangeAnalyzer.LOG.setUseParentHandlers(false);
        RangeAnalyzer.LOG.addHandler(handler);
        return handler;
    }

    private static void disableDebugLogging(Handler handler) {
        handler.flush();
        RangeAnalyzer.LOG.removeHandler(handler);
        RangeAnalyzer.LOG.setUseParentHandlers(true);
        RangeAnalyzer.LOG.setLevel(Level.INFO);
    }

    AnalysisConfig config() {
        AnalysisConfig config = AnalysisConfig.defaults();
        if (!options.isEmpty()) {
            config = config.withOptions(options);
        }
        if (all) {
            config = config.toBuilder().relevanceFilter(false).build();
        }
        for (String constraint : constraints) {
            config = config.withConstraint(DomainConstraint.parse(constraint));
        }
        return config;
    }

    private void print(AnalysisResult result) {
        if (summary) {
            out.printf("%d violations%n", result.violations().size());
            out.println(countTable("kind", result.countsPerKind()));
            out.println(countTable("contract", result.countsPerContract()));
        } else {
            result.violations().forEach(out::println);
        }
        if (functions) {
            result.summaries().values().forEach(out::println);
        }
        result.skipped().forEach(s -> out.println("skipped " + s));
    }

    private static String countTable(String header, Map<?, Integer> counts) {
        AsciiTable table = new AsciiTable();
        table.addRule();
        table.addRow(header, "violations");
        table.addRule();
        counts.forEach((key, count) -> table.addRow(key, count));
        table.addRule();
        table.setTextAlignment(TextAlignment.RIGHT);
        table.getContext().setGridTheme(TA_GridThemes.TOPBOTTOM);
        return table.render(60);
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }
}
