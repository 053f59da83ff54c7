package app;

import document.FlowGraphDocuments;
import document.FlowchartDocument;
import document.FunctionGraph;
import layout.Layout;
import layout.LayoutAssigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statement.FunctionBody;
import statement.InputLoopCollapser;
import statement.StatementNode;
import synthesis.CfgSynthesizer;
import synthesis.SynthesisResult;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.stream.Collectors;

/**
 * Converts function bodies into laid out flow graphs and flowchart documents.
 * Functions are independent of each other, so {@link #convertAll(List)} runs
 * them on a thread pool and keeps the input order in its result.
 */
public class FlowchartConverter {
    private static final Logger logger = LoggerFactory.getLogger(FlowchartConverter.class);

    private final FlowchartSettings settings;
    private final CfgSynthesizer synthesizer;
    private final LayoutAssigner layoutAssigner;
    private final InputLoopCollapser collapser;
    private final FlowGraphDocuments documents = new FlowGraphDocuments();

    public FlowchartConverter() {
        this(FlowchartSettings.load());
    }

    public FlowchartConverter(FlowchartSettings settings) {
        this.settings = settings;
        this.synthesizer = new CfgSynthesizer(settings.toLabels(), settings.isVerifyInvariants());
        this.layoutAssigner = new LayoutAssigner(settings.getOriginX(), settings.getOriginY(),
                settings.getColumnSpacing(), settings.getRowSpacing());
        this.collapser = settings.isCollapseInputLoops()
                ? new InputLoopCollapser(settings.getCollapseThreshold())
                : null;
    }

    public ConvertedFunction convert(FunctionBody function) {
        List<StatementNode> statements = function.getStatements();
        if (collapser != null) {
            statements = collapser.collapse(statements);
        }
        SynthesisResult result = synthesizer.synthesize(statements);
        Layout layout = layoutAssigner.assign(result.getGraph());
        if (!result.getDiagnostics().isEmpty()) {
            logger.info("Function {} converted with {} diagnostics", function.getName(), result.getDiagnostics().size());
        }
        return new ConvertedFunction(new FunctionGraph(function.getName(), result.getGraph(), layout), result);
    }

    public List<ConvertedFunction> convertAll(List<FunctionBody> functions) {
        if (functions.size() <= 1 || settings.getParallelism() == 1) {
            return functions.stream().map(this::convert).collect(Collectors.toList());
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(settings.getParallelism(), functions.size()));
        try {
            List<Future<ConvertedFunction>> futures = new ArrayList<>();
            for (FunctionBody function : functions) {
                futures.add(executor.submit(() -> convert(function)));
            }
            List<ConvertedFunction> converted = new ArrayList<>();
            for (Future<ConvertedFunction> future : futures) {
                converted.add(future.get());
            }
            return converted;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Conversion failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Conversion interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * A single function keeps its plain node ids; several functions are merged
     * side by side with namespaced ids.
     */
    public FlowchartDocument toDocument(List<ConvertedFunction> converted) {
        if (converted.size() == 1) {
            FunctionGraph only = converted.get(0).getFunctionGraph();
            return documents.toDocument(only.getGraph(), only.getLayout());
        }
        List<FunctionGraph> graphs = converted.stream()
                .map(ConvertedFunction::getFunctionGraph)
                .collect(Collectors.toList());
        return documents.merge(graphs, settings.getFunctionOffsetX());
    }

    public FlowGraphDocuments getDocuments() {
        return documents;
    }
}
