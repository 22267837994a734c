package org.processgraph.reasoning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.processgraph.reasoning.config.AnalysisConfigHelper;
import org.processgraph.reasoning.config.models.AnalysisConfig;
import org.processgraph.reasoning.diagnostics.ReachabilityDiagnostics;
import org.processgraph.reasoning.issues.Issue;
import org.processgraph.reasoning.lanes.CoherenceScorer;
import org.processgraph.reasoning.lanes.models.CoherenceReport;
import org.processgraph.reasoning.redistribution.RedistributionOrchestrator;
import org.processgraph.reasoning.redistribution.RedistributionValidationException;
import org.processgraph.reasoning.redistribution.models.Move;
import org.processgraph.reasoning.redistribution.models.RedistributionRequest;
import org.processgraph.reasoning.redistribution.models.RedistributionResult;
import org.processgraph.reasoning.redistribution.models.RedistributionStrategy;
import org.processgraph.reasoning.snapshot.BpmnLaneMembershipWriter;
import org.processgraph.reasoning.snapshot.BpmnModelLoader;
import org.processgraph.reasoning.snapshot.BpmnSnapshotBuilder;
import org.processgraph.reasoning.snapshot.GraphSnapshot;
import org.processgraph.reasoning.snapshot.OrderingHints;
import org.processgraph.reasoning.snapshot.models.Container;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line runner:
 * <pre>
 * Main &lt;file.bpmn&gt; [--config &lt;file.json&gt;] [--pool &lt;id&gt;] [--strategy &lt;name&gt;]
 *      [--validate] [--apply] [--out &lt;file.bpmn&gt;]
 * </pre>
 * Prints diagnostics, per-pool coherence and, when a strategy or {@code --validate} is given,
 * the redistribution result as JSON. Without {@code --apply} the redistribution is a dry run.
 */
@Slf4j
public class Main {
    // ------ Arguments
    private final String bpmnFilePath;
    private String configFilePath;
    private String poolId;
    private RedistributionStrategy strategy;
    private boolean validate;
    private boolean apply;
    private String outFilePath;

    // ------- Loaded model data
    private AnalysisConfig config;
    private BpmnModelInstance modelInstance;
    private GraphSnapshot snapshot;

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    Main(String bpmnFilePath) {
        this.bpmnFilePath = bpmnFilePath;
    }

    public Map<String, Object> run() throws IOException {
        loadInputs();

        Map<String, Object> report = new LinkedHashMap<>();
        List<Issue> diagnostics = ReachabilityDiagnostics.runAll(snapshot, config);
        report.put("diagnostics", diagnostics);
        report.put("coherence", scoreLanedPools());

        if (strategy != null || validate) {
            RedistributionResult result = redistribute();
            report.put("redistribution", result);
            if (result.applied()) {
                persist(result.moves());
            }
        }
        return report;
    }

    private void loadInputs() throws IOException {
        config = configFilePath == null
                ? AnalysisConfigHelper.loadDefaults()
                : AnalysisConfigHelper.loadConfigFile(configFilePath);
        modelInstance = BpmnModelLoader.load(new File(bpmnFilePath));
        snapshot = BpmnSnapshotBuilder.build(modelInstance);
        log.info("Loaded '{}': {} node(s), {} edge(s), {} pool(s)", bpmnFilePath,
                snapshot.nodes().size(), snapshot.edges().size(), snapshot.pools().size());
    }

    private Map<String, CoherenceReport> scoreLanedPools() {
        Map<String, CoherenceReport> reports = new LinkedHashMap<>();
        for (Container pool : snapshot.pools()) {
            if (!snapshot.lanesOf(pool.id()).isEmpty()) {
                reports.put(pool.id(), CoherenceScorer.score(snapshot, pool.id(), config.lowCoherenceThreshold));
            }
        }
        return reports;
    }

    private RedistributionResult redistribute() {
        RedistributionRequest request = RedistributionRequest.builder()
                .poolId(poolId)
                .strategy(strategy)
                .validate(validate)
                .dryRun(!apply)
                .orderingHint(OrderingHints.fromDiagram(modelInstance))
                .build();
        RedistributionOrchestrator orchestrator = new RedistributionOrchestrator(config,
                (pool, moves) -> log.info("{} moved element(s) in pool '{}' need repositioning", moves.size(), pool));
        return orchestrator.redistribute(snapshot, request);
    }

    private void persist(List<Move> moves) {
        Map<String, String> laneByNodeId = new LinkedHashMap<>();
        moves.forEach(move -> laneByNodeId.put(move.nodeId(), move.toLaneId()));
        int changed = BpmnLaneMembershipWriter.apply(modelInstance, laneByNodeId);
        File target = new File(outFilePath != null ? outFilePath : bpmnFilePath);
        BpmnModelLoader.write(target, modelInstance);
        log.info("Persisted {} lane change(s) to {}", changed, target);
    }

    static Main fromArgs(String[] args) {
        if (args.length == 0) {
            throw new IllegalArgumentException(usage());
        }
        Main main = new Main(args[0]);
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> main.configFilePath = valueOf(args, ++i);
                case "--pool" -> main.poolId = valueOf(args, ++i);
                case "--strategy" -> main.strategy = RedistributionStrategy.fromCode(valueOf(args, ++i));
                case "--validate" -> main.validate = true;
                case "--apply" -> main.apply = true;
                case "--out" -> main.outFilePath = valueOf(args, ++i);
                default -> throw new IllegalArgumentException("Unknown option '" + args[i] + "'\n" + usage());
            }
        }
        if (main.strategy == RedistributionStrategy.MANUAL) {
            throw new IllegalArgumentException("The manual strategy is not available from the command line");
        }
        return main;
    }

    private static String valueOf(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[index - 1] + "\n" + usage());
        }
        return args[index];
    }

    private static String usage() {
        return "Usage: Main <file.bpmn> [--config <file.json>] [--pool <id>] "
                + "[--strategy role-based|balance|minimize-crossings] [--validate] [--apply] [--out <file.bpmn>]";
    }

    public static void main(String[] args) {
        int exitCode = execute(args, System.out);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs the command line and prints the JSON report to {@code out}.
     *
     * @return 0 on success, 1 when the input cannot be analysed or redistribution is refused,
     * 2 for bad arguments
     */
    static int execute(String[] args, PrintStream out) {
        Main main;
        try {
            main = fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        }
        try {
            Map<String, Object> report = main.run();
            out.println(main.mapper.writeValueAsString(report));
            return 0;
        } catch (RedistributionValidationException e) {
            log.error("Redistribution refused: {}", e.getMessage());
            return 1;
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Cannot analyse '{}': {}", main.bpmnFilePath, e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to read input for '{}'", main.bpmnFilePath, e);
            return 1;
        }
    }
}
