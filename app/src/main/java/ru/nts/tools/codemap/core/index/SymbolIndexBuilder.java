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
package ru.nts.tools.codemap.core.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.codemap.core.EngineSettings;
import ru.nts.tools.codemap.core.scan.FileDescriptor;
import ru.nts.tools.codemap.core.scan.RepositoryScanner;
import ru.nts.tools.codemap.core.treesitter.Import;
import ru.nts.tools.codemap.core.treesitter.LanguageDetector;
import ru.nts.tools.codemap.core.treesitter.ParsedFile;
import ru.nts.tools.codemap.core.treesitter.Symbol;
import ru.nts.tools.codemap.core.treesitter.SymbolExtractor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Строит {@link SymbolIndex}: сканирует разбираемые файлы, извлекает символы и импорты,
 * разрешает относительные импорты в рёбра графа.
 * Ребро добавляется только если разрешённый файл существует.
 */
public final class SymbolIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(SymbolIndexBuilder.class);

    private final SymbolExtractor extractor;
    private final ImportResolver resolver;

    public SymbolIndexBuilder() {
        this(SymbolExtractor.getInstance(), new ImportResolver());
    }

    SymbolIndexBuilder(SymbolExtractor extractor, ImportResolver resolver) {
        this.extractor = extractor;
        this.resolver = resolver;
    }

    public SymbolIndex build(Path root) {
        return build(root, EngineSettings.DEFAULT_MAX_DEPTH);
    }

    /**
     * @param root корень проекта
     * @param maxDepth глубина сканирования
     * @throws ru.nts.tools.codemap.core.CodeMapException PROJECT_NOT_FOUND если корня нет
     */
    public SymbolIndex build(Path root, int maxDepth) {
        long startTime = System.currentTimeMillis();
        RepositoryScanner scanner = new RepositoryScanner(root, maxDepth);
        Path normalizedRoot = scanner.getRoot();

        Map<String, List<Symbol>> symbolsByFile = new LinkedHashMap<>();
        Map<String, List<SymbolOccurrence>> symbolsByName = new LinkedHashMap<>();
        Map<String, List<Import>> importsByFile = new LinkedHashMap<>();
        ImportGraph.Builder graph = ImportGraph.builder();
        int skipped = 0;

        Iterable<FileDescriptor> files = scanner.scan(LanguageDetector.PARSEABLE_EXTENSIONS)::iterator;
        for (FileDescriptor file : files) {
            Optional<ParsedFile> parsed = parse(file);
            if (parsed.isEmpty()) {
                skipped++;
                continue;
            }

            String relPath = file.relativePath();
            symbolsByFile.put(relPath, parsed.get().symbols());
            importsByFile.put(relPath, parsed.get().imports());

            for (Symbol symbol : parsed.get().symbols()) {
                symbolsByName.computeIfAbsent(symbol.name(), k -> new ArrayList<>())
                        .add(new SymbolOccurrence(relPath, symbol));
            }

            for (Import imp : parsed.get().imports()) {
                resolver.resolve(normalizedRoot, relPath, imp)
                        .filter(ImportResolution::exists)
                        .ifPresent(resolution -> graph.addEdge(relPath, resolution.relativePath()));
            }
        }

        SymbolIndex index = new SymbolIndex(normalizedRoot, symbolsByFile, symbolsByName, importsByFile, graph.build());
        log.info("Indexed {} files ({} skipped), {} symbols, {} import edges in {} ms",
                symbolsByFile.size(), skipped, index.symbolCount(), index.importGraph().edgeCount(),
                System.currentTimeMillis() - startTime);
        return index;
    }

    private Optional<ParsedFile> parse(FileDescriptor file) {
        try {
            return extractor.parse(Files.readAllBytes(file.path()), file.language());
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", file.relativePath(), e.getMessage());
            return Optional.empty();
        }
    }
}
