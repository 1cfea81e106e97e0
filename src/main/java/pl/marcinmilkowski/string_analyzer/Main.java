package pl.marcinmilkowski.string_analyzer;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.string_analyzer.analysis.PropertyAnalyzer;
import pl.marcinmilkowski.string_analyzer.api.StringAnalyzerApiServer;
import pl.marcinmilkowski.string_analyzer.config.ServiceConfig;
import pl.marcinmilkowski.string_analyzer.query.InterpretedQuery;
import pl.marcinmilkowski.string_analyzer.query.NaturalLanguageTranslator;
import pl.marcinmilkowski.string_analyzer.service.StringAnalysisService;
import pl.marcinmilkowski.string_analyzer.store.StringStore;
import pl.marcinmilkowski.string_analyzer.store.StringStoreFactory;
import pl.marcinmilkowski.string_analyzer.store.StringStoreFactory.StoreType;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Arrays;

/**
 * Main entry point for the String Analyzer application.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase();

            switch (command) {
                case "server":
                    handleServerCommand(args);
                    break;
                case "analyze":
                    handleAnalyzeCommand(args);
                    break;
                case "translate":
                    handleTranslateCommand(args);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
        }
    }

    private static void handleServerCommand(String[] args) throws IOException {
        String configPath = null;
        Integer port = null;
        StoreType storeType = null;
        String indexPath = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                case "-c":
                    configPath = args[++i];
                    break;
                case "--port":
                case "-p":
                    port = Integer.parseInt(args[++i]);
                    break;
                case "--store":
                case "-s":
                    storeType = StoreType.fromName(args[++i]);
                    break;
                case "--index":
                case "-i":
                    indexPath = args[++i];
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        ServiceConfig base = configPath != null ? ServiceConfig.load(Paths.get(configPath)) : ServiceConfig.loadDefault();
        ServiceConfig config = base.withOverrides(port, storeType, indexPath);
        logger.info("Active config: {}", config.toJson());

        StringStore store = StringStoreFactory.create(config.getStoreType(), config.getIndexPath());
        StringAnalysisService service = new StringAnalysisService(store, config.getMaxValueLength());
        StringAnalyzerApiServer server = StringAnalyzerApiServer.builder()
            .withService(service)
            .withPort(config.getPort())
            .withThreads(config.getThreads())
            .build();

        server.start();
        System.out.println("Press Ctrl+C to stop the server.");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("\nShutting down...");
            server.stop();
            try {
                store.close();
            } catch (IOException e) {
                logger.warn("Failed to close {} store: {}", store.getName(), e.getMessage());
            }
        }));

        // Keep running until interrupted
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void handleAnalyzeCommand(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: java -jar string-analyzer-lucene.jar analyze <value>");
            return;
        }
        String value = String.join(" ", Arrays.copyOfRange(args, 1, args.length));
        var bundle = new PropertyAnalyzer().analyze(value);
        System.out.println(JSON.toJSONString(bundle.toJson(), JSONWriter.Feature.PrettyFormat));
    }

    private static void handleTranslateCommand(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: java -jar string-analyzer-lucene.jar translate <query>");
            return;
        }
        String query = String.join(" ", Arrays.copyOfRange(args, 1, args.length));
        try {
            InterpretedQuery interpreted = new NaturalLanguageTranslator().translate(query);
            System.out.println(JSON.toJSONString(interpreted.toJson(), JSONWriter.Feature.PrettyFormat));
        } catch (StringAnalyzerException e) {
            System.err.println(e.getKind() + ": " + e.getMessage());
        }
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar string-analyzer-lucene.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  server     Start the REST API server");
        System.out.println("  analyze    Print the properties of a string");
        System.out.println("  translate  Print the filters a natural-language query translates to");
        System.out.println("  help       Show this help message");
        System.out.println();
        System.out.println("Server options:");
        System.out.println("  --config, -c <file>    JSON config (default: bundled string-analyzer.json)");
        System.out.println("  --port, -p <port>      Port to listen on");
        System.out.println("  --store, -s <type>     memory or lucene");
        System.out.println("  --index, -i <path>     Lucene index directory");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar string-analyzer-lucene.jar server --store lucene --index data/strings-index");
        System.out.println("  java -jar string-analyzer-lucene.jar analyze \"A man a plan\"");
        System.out.println("  java -jar string-analyzer-lucene.jar translate \"single word palindromic strings\"");
    }
}
