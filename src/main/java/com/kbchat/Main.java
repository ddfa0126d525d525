package com.kbchat;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kbchat.error.KbChatException;
import com.kbchat.retrieval.RetrievalRequest;
import com.kbchat.retrieval.RetrievalResult;
import com.kbchat.runtime.AppConfig;
import com.kbchat.runtime.KbChatApplication;
import com.kbchat.sync.RebuildStats;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "kb-chat",
        mixinStandardHelpOptions = true,
        version = "kb-chat 0.1.0",
        description = "Knowledge-base chatbot: index sync and retrieval-augmented answers.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final String CONSOLE_HELP = """
            Type a question, or one of:
              /status   show synchronizer status
              /rebuild  rebuild the index now
              /help     show this help
              /exit     quit""";

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "serve")
    Mode mode;

    @Option(names = "--query", description = "Question used in retrieve mode")
    String query;

    @Option(names = "--top-k", description = "Number of neighbors to retrieve (defaults to retrieval.defaultTopK)")
    Integer topK;

    @Option(names = "--index-path", description = "Overrides index.structurePath from the config")
    Path indexPath;

    Map<String, String> environment = System.getenv();
    InputStream console = System.in;

    private final ObjectMapper json = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    enum Mode {
        retrieve,
        rebuild,
        status,
        serve
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (mode == Mode.retrieve && (query == null || query.isBlank())) {
            log.error("--query is required in retrieve mode");
            return 2;
        }

        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting kb-chat in {} mode", mode);
        log.info("Using config file: {}", configPath);

        PrintWriter out = spec.commandLine().getOut();
        try (KbChatApplication app = KbChatApplication.create(config, environment, indexPath)) {
            switch (mode) {
                case retrieve -> {
                    RetrievalResult result = app.orchestrator().retrieve(new RetrievalRequest(query, null, topK));
                    print(out, result);
                }
                case rebuild -> print(out, app.synchronizer().forceRebuild());
                case status -> print(out, app.synchronizer().status());
                case serve -> runConsole(app, out);
            }
            return 0;
        } catch (KbChatException e) {
            log.error("request.failed category={} error={}", e.category(), e.getMessage());
            spec.commandLine().getErr().println(e.category() + ": " + e.getMessage());
            return e.category().exitCode();
        }
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            log.warn("Config file {} not found, using defaults", config);
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private void runConsole(KbChatApplication app, PrintWriter out) throws IOException {
        app.startSync();
        BufferedReader reader = new BufferedReader(new InputStreamReader(console, StandardCharsets.UTF_8));
        out.println(CONSOLE_HELP);
        out.flush();
        while (true) {
            out.print("> ");
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            String input = line.strip();
            if (input.isEmpty()) {
                continue;
            }
            if ("/exit".equalsIgnoreCase(input)) {
                break;
            }
            try {
                switch (input.toLowerCase(Locale.ROOT)) {
                    case "/help" -> out.println(CONSOLE_HELP);
                    case "/status" -> print(out, app.synchronizer().status());
                    case "/rebuild" -> {
                        RebuildStats stats = app.synchronizer().forceRebuild();
                        print(out, stats);
                    }
                    default -> {
                        RetrievalResult result = app.orchestrator().retrieve(new RetrievalRequest(input, null, topK));
                        out.println(result.answer());
                        out.printf(Locale.ROOT, "(confidence %.2f, sources %s, %d ms)%n",
                                result.confidence(), result.sourceIds(), result.latencyMs());
                    }
                }
            } catch (KbChatException e) {
                log.warn("console.request.failed category={} error={}", e.category(), e.getMessage());
                out.println(e.category() + ": " + e.getMessage());
            }
            out.flush();
        }
        log.info("console.closed");
    }

    private void print(PrintWriter out, Object value) throws IOException {
        out.println(json.writeValueAsString(value));
        out.flush();
    }
}
