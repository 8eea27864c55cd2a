/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.codemap;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import ru.nts.tools.codemap.core.CodeMapEngine;
import ru.nts.tools.codemap.core.CodeMapException;
import ru.nts.tools.codemap.core.EngineSettings;
import ru.nts.tools.codemap.core.QueryResult;
import ru.nts.tools.codemap.core.analysis.CallDirection;
import ru.nts.tools.codemap.core.analysis.CallGraphAnalyzer;
import ru.nts.tools.codemap.core.analysis.CompressionMode;
import ru.nts.tools.codemap.core.analysis.SmartContextFinder;
import ru.nts.tools.codemap.core.analysis.SymbolSearch;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Командная строка над {@link CodeMapEngine}.
 * Результат печатается в stdout как JSON, логи и справка по ошибкам идут в stderr.
 * <p>
 * Коды выхода: 0 успех, 1 ошибка запроса, 2 ошибка использования.
 */
@CommandLine.Command(
        name = "codemap",
        mixinStandardHelpOptions = true,
        version = "codemap 1.0.0",
        description = "Code index and dependency graph queries over a project. Results are printed as JSON.",
        footer = "%nEnvironment: CODEMAP_ROOT, CODEMAP_MAX_DEPTH, CODEMAP_DEBUG",
        subcommands = {
                CodeMapCli.ScanCommand.class,
                CodeMapCli.StatsCommand.class,
                CodeMapCli.SymbolsCommand.class,
                CodeMapCli.DepsCommand.class,
                CodeMapCli.CallGraphCommand.class,
                CodeMapCli.FlowCommand.class,
                CodeMapCli.ImpactCommand.class,
                CodeMapCli.CompressCommand.class,
                CodeMapCli.UsagesCommand.class,
                CodeMapCli.SearchCommand.class,
                CodeMapCli.ContextCommand.class
        })
public final class CodeMapCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CodeMapCli.class);

    static final int EXIT_OK = CommandLine.ExitCode.OK;
    static final int EXIT_ERROR = CommandLine.ExitCode.SOFTWARE;
    static final int EXIT_USAGE = CommandLine.ExitCode.USAGE;

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.WRITE_ENUMS_USING_TO_STRING);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--root", description = "Project root. Defaults to CODEMAP_ROOT, then the working directory.")
    private Path root;

    private final PrintStream out;
    private final PrintStream err;
    private Map<String, String> env = Map.of();

    CodeMapCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        // stdout несёт JSON: принудительно UTF-8 независимо от кодировки консоли
        System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));

        int exitCode = new CodeMapCli(System.out, System.err).run(args, System.getenv());
        System.exit(exitCode);
    }

    /**
     * Разбирает аргументы и выполняет команду.
     *
     * @param args аргументы командной строки
     * @param env окружение (CODEMAP_ROOT, CODEMAP_MAX_DEPTH, CODEMAP_DEBUG)
     * @return код выхода
     */
    int run(String[] args, Map<String, String> env) {
        this.env = env;
        // picocli запоминает текущее значение поля как значение по умолчанию
        this.root = null;
        CommandLine commandLine = new CommandLine(this)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setOut(new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), true))
                .setErr(new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8), true));
        return commandLine.execute(args);
    }

    /**
     * Вызов без подкоманды.
     */
    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing command");
    }

    // ===================== ВЫПОЛНЕНИЕ =====================

    private int execute(String command, Function<CodeMapEngine, QueryResult<?>> query) {
        EngineSettings settings;
        try {
            settings = EngineSettings.fromEnvironment(env);
        } catch (CodeMapException e) {
            // Ошибка окружения до обращения к движку
            printError(QueryResult.failure(e));
            return EXIT_USAGE;
        }
        if (root != null) {
            settings = settings.withProjectRoot(root);
        }
        if (settings.debug()) {
            enableDebugLogging();
        }
        log.debug("Running '{}' on {}", command, settings.projectRoot());
        return print(query.apply(new CodeMapEngine(settings)));
    }

    private int print(QueryResult<?> result) {
        if (!result.isSuccess()) {
            printError(result);
            return EXIT_ERROR;
        }
        try {
            out.println(mapper.writeValueAsString(result.value()));
            return EXIT_OK;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize result", e);
            return EXIT_ERROR;
        }
    }

    private void printError(QueryResult<?> result) {
        ObjectNode node = mapper.createObjectNode();
        node.set("error", mapper.valueToTree(result.error()));
        try {
            out.println(mapper.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize error", e);
        }
    }

    private static void enableDebugLogging() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger("ru.nts.tools.codemap").setLevel(Level.DEBUG);
        }
    }

    // ===================== ПОДКОМАНДЫ =====================

    /**
     * Подкоманда, которая выполняет один запрос к движку.
     */
    abstract static class QueryCommand implements Callable<Integer> {

        @CommandLine.ParentCommand
        CodeMapCli cli;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        abstract QueryResult<?> query(CodeMapEngine engine);

        @Override
        public Integer call() {
            return cli.execute(spec.name(), this::query);
        }
    }

    @CommandLine.Command(name = "scan", mixinStandardHelpOptions = true, description = "List project files.")
    static final class ScanCommand extends QueryCommand {
        @Override
        QueryResult<?> query(CodeMapEngine engine) {
            return engine.scan();
        }
    }

    @CommandLine.Command(name = "stats", mixinStandardHelpOptions = true, description = "File, line and language counts.")
    static final class StatsCommand extends QueryCommand {
        @Override
        QueryResult<?> query(CodeMapEngine engine) {
            return engine.stats();
        }
    }

    @CommandLine.Command(name = "symbols", mixinStandardHelpOptions = true, description = "Definitions of a symbol.")
    static final class SymbolsCommand extends QueryCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "<name>", description = "Symbol name.")
        String name;

        @Override
        QueryResult<?> query(CodeMapEngine engine) {
            return engine.findSymbol(name);
        }
    }

    @CommandLine.Command(name = "deps", mixinStandardHelpOptions = true, description = "Imports and importers of a file.")
    static final class DepsCommand extends QueryCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "<file>", description = "Path relative to the project root.")
        String file;

        @Override
        QueryResult<?> query(CodeMapEngine engine) {
            return engine.dependencies(file);
        }
    }

    @CommandLine.Command(name = "callgraph", mixinStandardHelpOptions = true, description = "Callers and callees of a function.")
    static final class CallGraphCommand extends QueryCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "<name>", description = "Function or method name.")
        String name;

        @CommandLine.Option(names = {"-d", "--direction"}, defaultValue = "BOTH",
                description = "One of: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}.")
        CallDirection direction;

        @CommandLine.Option(names = "--depth", defaultValue = "3", description = "Accepted for compatibility, lists are one hop.")
        int depth;

        @Override
        QueryResult<?> query(CodeMapEngine engine) {
            return engine.callGraph(name, direction, depth);
        }
    }

    @CommandLine.Command(name = "flow", mixinStandardHelpOptions = true, description = "Trace calls from an entry point.")
    static final class FlowCommand extends QueryCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "<name>", description = "Entry point.")
        String name;

        @CommandLine.Option(names = "--max-depth", defaultValue = "" + CallGraphAnalyzer.DEFAULT_FLOW_DEPTH,
                description = "Deepest step to print. Default: ${DEFAULT-VALUE}.")
        int maxDepth;

        @Override
        QueryResult<?> query(CodeMapEngine engine) {
            return engine.traceFlow(name, maxDepth);
        }
    }

    @CommandLine.Command(name = "impact", mixinStandardHelpOptions = true, description = "Dependents and risk of changing a file.")
    static final class ImpactCommand extends QueryCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "<file>", description = "Path relative to the project root.")
        String file;

        @Override
        QueryResult<?> query(CodeMapEngine engine) {
            return engine.impact(file);
        }
    }

    @CommandLine.Command(name = "compress", mixinStandardHelpOptions = true, description = "Render files into a token budget.")
    static final class CompressCommand extends QueryCommand {
        @CommandLine.Option(names = {"-m", "--mode"}, defaultValue = "SMART",
                description = "One of: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}.")
        CompressionMode mode;

        @CommandLine.Option(names = {"-b", "--budget"}, required = true, description = "Token budget.")
        int budget;

        @CommandLine.Parameters(arity = "1..*", paramLabel = "<file>", description = "Files in priority order.")
        List<String> files;

        @Override
        QueryResult<?> query(CodeMapEngine engine) {
            return engine.compress(files, mode, budget);
        }
    }

    @CommandLine.Command(name = "usages", mixinStandardHelpOptions = true, description = "Every line mentioning a name.")
    static final class UsagesCommand extends QueryCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "<name>", description = "Name to look for.")
        String name;

        @Override
        QueryResult<?> query(CodeMapEngine engine) {
            return engine.findUsages(name);
        }
    }

    @CommandLine.Command(name = "search", mixinStandardHelpOptions = true, description = "Symbols and lines matching the keywords of a question.")
    static final class SearchCommand extends QueryCommand {
        @CommandLine.Parameters(arity = "1..*", paramLabel = "<word>", description = "Question or keywords.")
        List<String> words;

        @CommandLine.Option(names = "--top-k", defaultValue = "" + SymbolSearch.DEFAULT_TOP_K,
                description = "Maximum results. Default: ${DEFAULT-VALUE}.")
        int topK;

        @Override
        QueryResult<?> query(CodeMapEngine engine) {
            return engine.search(String.join(" ", words), topK);
        }
    }

    @CommandLine.Command(name = "context", mixinStandardHelpOptions = true, description = "Files relevant to a question, within a token budget.")
    static final class ContextCommand extends QueryCommand {
        @CommandLine.Parameters(arity = "1..*", paramLabel = "<word>", description = "Question.")
        List<String> words;

        @CommandLine.Option(names = "--max-tokens", defaultValue = "" + SmartContextFinder.DEFAULT_MAX_TOKENS,
                description = "Token budget. Default: ${DEFAULT-VALUE}.")
        int maxTokens;

        @Override
        QueryResult<?> query(CodeMapEngine engine) {
            return engine.smartContext(String.join(" ", words), maxTokens);
        }
    }
}
