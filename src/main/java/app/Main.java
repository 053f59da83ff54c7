package app;

import document.DotExporter;
import document.FlowchartDocument;
import frontend.JavaStatementExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statement.Diagnostic;
import statement.FunctionBody;
import statement.StatementTreeException;
import statement.StatementTreeReader;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point:
 * {@code Main <source.java|statements.json> [<output.json>] [--dot <file.dot>] [--settings <settings.json>]}.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String USAGE =
            "Usage: java app.Main <source.java|statements.json> [<output.json>] [--dot <file.dot>] [--settings <settings.json>]";

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args) {
        List<String> positional = new ArrayList<>();
        Path dotPath = null;
        Path settingsPath = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--dot") || arg.equals("--settings")) {
                if (i + 1 >= args.length) {
                    System.err.println("Missing value for " + arg);
                    System.err.println(USAGE);
                    return 2;
                }
                Path value = Paths.get(args[++i]);
                if (arg.equals("--dot")) {
                    dotPath = value;
                } else {
                    settingsPath = value;
                }
            } else {
                positional.add(arg);
            }
        }
        if (positional.isEmpty() || positional.size() > 2) {
            System.err.println(USAGE);
            return 2;
        }

        Path sourcePath = Paths.get(positional.get(0));
        Path outputPath = positional.size() == 2
                ? Paths.get(positional.get(1))
                : Paths.get(positional.get(0) + ".flow.json");
        if (positional.size() == 1) {
            logger.info("No output path specified, using default: {}", outputPath);
        }

        try {
            FlowchartSettings settings = settingsPath == null
                    ? FlowchartSettings.load()
                    : FlowchartSettings.load(settingsPath);
            List<FunctionBody> functions = readFunctions(sourcePath);
            if (functions.isEmpty()) {
                System.err.println("No function bodies found in " + sourcePath);
                return 1;
            }

            FlowchartConverter converter = new FlowchartConverter(settings);
            List<ConvertedFunction> converted = converter.convertAll(functions);
            for (ConvertedFunction function : converted) {
                for (Diagnostic diagnostic : function.getDiagnostics()) {
                    logger.warn("{}: {}", function.getName(), diagnostic);
                }
            }

            FlowchartDocument document = converter.toDocument(converted);
            converter.getDocuments().write(document, outputPath);
            if (dotPath != null) {
                exportDot(converted, dotPath);
            }
            return 0;
        } catch (StatementTreeException e) {
            logger.error("Rejected input {}: {}", sourcePath, e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("I/O error: {}", e.getMessage(), e);
            return 1;
        }
    }

    static List<FunctionBody> readFunctions(Path sourcePath) throws IOException, StatementTreeException {
        String fileName = sourcePath.getFileName().toString();
        if (fileName.endsWith(".java")) {
            return new JavaStatementExtractor().extract(sourcePath);
        }
        return new StatementTreeReader().read(sourcePath);
    }

    private static void exportDot(List<ConvertedFunction> converted, Path dotPath) throws IOException {
        DotExporter exporter = new DotExporter();
        if (converted.size() == 1) {
            exporter.export(converted.get(0).getFunctionGraph().getGraph(), dotPath);
            return;
        }
        String base = dotPath.getFileName().toString().replaceFirst("\\.dot$", "");
        for (ConvertedFunction function : converted) {
            Path target = dotPath.resolveSibling(base + "_" + function.getName() + ".dot");
            exporter.export(function.getFunctionGraph().getGraph(), target);
        }
    }
}
