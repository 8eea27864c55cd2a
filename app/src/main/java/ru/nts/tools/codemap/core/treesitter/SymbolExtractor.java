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
package ru.nts.tools.codemap.core.treesitter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSTree;
import ru.nts.tools.codemap.core.EncodingUtils;
import ru.nts.tools.codemap.core.treesitter.extractors.JavaScriptSymbolExtractor;
import ru.nts.tools.codemap.core.treesitter.extractors.LanguageSymbolExtractor;
import ru.nts.tools.codemap.core.treesitter.extractors.PythonSymbolExtractor;
import ru.nts.tools.codemap.core.treesitter.extractors.TypeScriptSymbolExtractor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Извлекает символы и импорты из файла с помощью tree-sitter.
 * Обходит дерево сам и передаёт имя объемлющего класса явным параметром,
 * а разбор конкретных узлов делегирует {@link LanguageSymbolExtractor} своего языка.
 * <p>
 * Файл с синтаксическими ошибками или бинарным содержимым считается неразбираемым:
 * частичных результатов не бывает.
 */
public final class SymbolExtractor {

    private static final Logger log = LoggerFactory.getLogger(SymbolExtractor.class);

    private static final SymbolExtractor INSTANCE = new SymbolExtractor();

    private final Map<Language, LanguageSymbolExtractor> extractors;
    private final TreeSitterManager treeSitter = TreeSitterManager.getInstance();

    private SymbolExtractor() {
        Map<Language, LanguageSymbolExtractor> map = new EnumMap<>(Language.class);
        map.put(Language.PYTHON, new PythonSymbolExtractor());
        map.put(Language.JAVASCRIPT, new JavaScriptSymbolExtractor());
        map.put(Language.TYPESCRIPT, new TypeScriptSymbolExtractor());
        this.extractors = Map.copyOf(map);
    }

    public static SymbolExtractor getInstance() {
        return INSTANCE;
    }

    /**
     * Разбирает сырые байты файла.
     *
     * @param bytes содержимое файла
     * @param language язык файла
     * @return результат разбора или пусто, если файл не разбирается
     */
    public Optional<ParsedFile> parse(byte[] bytes, Language language) {
        if (!extractors.containsKey(language)) {
            return Optional.empty();
        }
        String content;
        try {
            content = EncodingUtils.decode(bytes).content();
        } catch (IOException e) {
            log.debug("Skipping undecodable {} content: {}", language, e.getMessage());
            return Optional.empty();
        }
        return parse(content, language);
    }

    /**
     * Разбирает уже декодированное содержимое.
     */
    public Optional<ParsedFile> parse(String content, Language language) {
        LanguageSymbolExtractor extractor = extractors.get(language);
        if (extractor == null) {
            return Optional.empty();
        }

        try {
            TSTree tree = treeSitter.parse(content, language);
            TSNode root = tree.getRootNode();

            SyntaxChecker.SyntaxCheckResult check = SyntaxChecker.check(root);
            if (check.hasErrors()) {
                SyntaxChecker.SyntaxError first = check.errors().get(0);
                log.debug("Unparseable {} content: {} at {}:{}",
                        language, first.message(), first.line(), first.column());
                return Optional.empty();
            }

            byte[] source = content.getBytes(StandardCharsets.UTF_8);
            List<Symbol> symbols = new ArrayList<>();
            List<Import> imports = new ArrayList<>();
            extractRecursive(root, source, extractor, "", symbols, imports);

            return Optional.of(new ParsedFile(language, symbols, imports));
        } catch (RuntimeException e) {
            // Ошибка одного файла не должна ронять построение индекса
            log.debug("Failed to extract symbols from {} content", language, e);
            return Optional.empty();
        }
    }

    /**
     * Читает и разбирает файл с диска, язык определяется по расширению.
     */
    public Optional<ParsedFile> parseFile(Path path) {
        Language language = LanguageDetector.detect(path);
        if (!extractors.containsKey(language)) {
            return Optional.empty();
        }
        try {
            return parse(Files.readAllBytes(path), language);
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean supports(Language language) {
        return extractors.containsKey(language);
    }

    /**
     * Рекурсивно обходит AST.
     * Тело класса обходится с именем класса как родителем, тело функции с пустым родителем.
     */
    private void extractRecursive(TSNode node, byte[] source, LanguageSymbolExtractor extractor,
                                  String parentName, List<Symbol> symbols, List<Import> imports) {
        String nodeType = node.getType();

        Optional<Symbol> symbol = extractor.extractSymbol(node, nodeType, source, parentName);
        symbol.ifPresent(symbols::add);
        imports.addAll(extractor.extractImports(node, nodeType, source));

        String childParent = parentName;
        if (symbol.isPresent()) {
            childParent = symbol.get().kind() == SymbolKind.CLASS ? symbol.get().name() : "";
        }

        int childCount = node.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull()) {
                extractRecursive(child, source, extractor, childParent, symbols, imports);
            }
        }
    }
}
