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
package ru.nts.tools.codemap.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.codemap.core.analysis.CallDirection;
import ru.nts.tools.codemap.core.analysis.CallGraphAnalyzer;
import ru.nts.tools.codemap.core.analysis.CallGraphResult;
import ru.nts.tools.codemap.core.analysis.ChangeImpactAnalyzer;
import ru.nts.tools.codemap.core.analysis.CompressedContext;
import ru.nts.tools.codemap.core.analysis.CompressionMode;
import ru.nts.tools.codemap.core.analysis.ContextCompressor;
import ru.nts.tools.codemap.core.analysis.FlowTrace;
import ru.nts.tools.codemap.core.analysis.ImpactReport;
import ru.nts.tools.codemap.core.analysis.SearchHit;
import ru.nts.tools.codemap.core.analysis.SmartContext;
import ru.nts.tools.codemap.core.analysis.SmartContextFinder;
import ru.nts.tools.codemap.core.analysis.SymbolSearch;
import ru.nts.tools.codemap.core.analysis.Usage;
import ru.nts.tools.codemap.core.analysis.UsageFinder;
import ru.nts.tools.codemap.core.index.FileDependencies;
import ru.nts.tools.codemap.core.index.RelativePaths;
import ru.nts.tools.codemap.core.index.SymbolIndex;
import ru.nts.tools.codemap.core.index.SymbolIndexBuilder;
import ru.nts.tools.codemap.core.index.SymbolOccurrence;
import ru.nts.tools.codemap.core.scan.FileDescriptor;
import ru.nts.tools.codemap.core.scan.RepoStats;
import ru.nts.tools.codemap.core.scan.RepositoryScanner;
import ru.nts.tools.codemap.core.treesitter.ParsedFile;
import ru.nts.tools.codemap.core.treesitter.SymbolExtractor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Точка входа в движок: {@code (projectRoot, параметры) -> результат}.
 * Каждый запрос строит индекс заново; ошибки возвращаются как {@link QueryResult}, а не бросаются.
 */
public final class CodeMapEngine {

    private static final Logger log = LoggerFactory.getLogger(CodeMapEngine.class);

    private final EngineSettings settings;
    private final SymbolIndexBuilder indexBuilder;

    public CodeMapEngine(EngineSettings settings) {
        this.settings = settings;
        this.indexBuilder = new SymbolIndexBuilder();
    }

    public QueryResult<SymbolIndex> buildIndex() {
        return execute("buildIndex", this::index);
    }

    public QueryResult<List<FileDescriptor>> scan() {
        return execute("scan", () -> {
            try (Stream<FileDescriptor> files = scanner().scan()) {
                return files.toList();
            }
        });
    }

    public QueryResult<RepoStats> stats() {
        return execute("stats", () -> RepoStats.collect(scanner().scan()));
    }

    /**
     * Разбирает один файл без построения индекса.
     */
    public QueryResult<ParsedFile> parseFile(String file) {
        return execute("parseFile", () -> {
            String relPath = RelativePaths.normalize(file);
            Path path = RelativePaths.requireFile(projectRoot(), relPath);
            return SymbolExtractor.getInstance().parseFile(path)
                    .orElseThrow(() -> new CodeMapException(ErrorCode.UNPARSEABLE_FILE, "path", relPath));
        });
    }

    /**
     * Все определения имени в порядке сканирования.
     */
    public QueryResult<List<SymbolOccurrence>> findSymbol(String name) {
        return execute("findSymbol", () -> {
            requireName("name", name);
            List<SymbolOccurrence> occurrences = index().occurrences(name);
            if (occurrences.isEmpty()) {
                throw new CodeMapException(ErrorCode.SYMBOL_NOT_FOUND, "symbol", name);
            }
            return occurrences;
        });
    }

    public QueryResult<FileDependencies> dependencies(String file) {
        return execute("dependencies", () -> {
            String relPath = RelativePaths.normalize(file);
            RelativePaths.requireFile(projectRoot(), relPath);
            return FileDependencies.of(index(), relPath);
        });
    }

    public QueryResult<CallGraphResult> callGraph(String name, CallDirection direction, int depth) {
        return execute("callGraph", () -> {
            requireName("name", name);
            return new CallGraphAnalyzer(index()).callGraph(name, direction, depth);
        });
    }

    public QueryResult<FlowTrace> traceFlow(String entryPoint, int maxDepth) {
        return execute("traceFlow", () -> {
            requireName("entryPoint", entryPoint);
            if (maxDepth < 0) {
                throw new CodeMapException(ErrorCode.INVALID_PARAMETER, Map.of("name", "maxDepth", "value", maxDepth));
            }
            return new CallGraphAnalyzer(index()).traceFlow(entryPoint, maxDepth);
        });
    }

    public QueryResult<ImpactReport> impact(String file) {
        return execute("impact", () -> new ChangeImpactAnalyzer(index()).analyze(file));
    }

    /**
     * Упаковка файлов в бюджет; индекс не строится.
     */
    public QueryResult<CompressedContext> compress(List<String> files, CompressionMode mode, int budgetTokens) {
        return execute("compress", () -> {
            if (!Files.isDirectory(projectRoot())) {
                throw new CodeMapException(ErrorCode.PROJECT_NOT_FOUND, "root", projectRoot().toString());
            }
            return new ContextCompressor().compress(projectRoot(), files, mode, budgetTokens);
        });
    }

    public QueryResult<List<Usage>> findUsages(String name) {
        return execute("findUsages", () -> {
            requireName("name", name);
            return new UsageFinder(index()).findUsages(name);
        });
    }

    /**
     * Поиск символов и упоминаний по ключевым словам вопроса.
     */
    public QueryResult<List<SearchHit>> search(String query, int topK) {
        return execute("search", () -> {
            requireName("query", query);
            return new SymbolSearch(index()).search(query, topK);
        });
    }

    /**
     * Файлы, относящиеся к вопросу, в бюджет токенов.
     */
    public QueryResult<SmartContext> smartContext(String question, int maxTokens) {
        return execute("smartContext", () -> {
            requireName("question", question);
            return new SmartContextFinder(index()).find(question, maxTokens);
        });
    }

    // ===================== ВНУТРЕННЕЕ =====================

    private Path projectRoot() {
        return settings.projectRoot();
    }

    private SymbolIndex index() {
        return indexBuilder.build(projectRoot(), settings.maxDepth());
    }

    private RepositoryScanner scanner() {
        return new RepositoryScanner(projectRoot(), settings.maxDepth());
    }

    private static void requireName(String param, String value) {
        if (value == null || value.isBlank()) {
            throw new CodeMapException(ErrorCode.INVALID_PARAMETER, Map.of("name", param, "value", String.valueOf(value)));
        }
    }

    /**
     * Выполняет операцию и переводит исключения в структурированный результат.
     */
    private <T> QueryResult<T> execute(String operation, Supplier<T> action) {
        try {
            return QueryResult.ok(action.get());
        } catch (CodeMapException e) {
            log.debug("{} failed: {}", operation, e.toLogMessage());
            return QueryResult.failure(e);
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly", operation, e);
            return QueryResult.failure(new CodeMapException(ErrorCode.INTERNAL_ERROR,
                    Map.of("operation", operation, "error", String.valueOf(e.getMessage())), e));
        }
    }
}
