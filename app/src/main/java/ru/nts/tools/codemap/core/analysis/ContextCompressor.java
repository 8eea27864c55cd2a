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
package ru.nts.tools.codemap.core.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.codemap.core.CodeMapException;
import ru.nts.tools.codemap.core.EncodingUtils;
import ru.nts.tools.codemap.core.ErrorCode;
import ru.nts.tools.codemap.core.index.RelativePaths;
import ru.nts.tools.codemap.core.treesitter.Language;
import ru.nts.tools.codemap.core.treesitter.LanguageDetector;
import ru.nts.tools.codemap.core.treesitter.ParsedFile;
import ru.nts.tools.codemap.core.treesitter.Symbol;
import ru.nts.tools.codemap.core.treesitter.SymbolExtractor;
import ru.nts.tools.codemap.core.treesitter.SymbolKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Отрисовывает набор файлов в бюджет токенов.
 * <p>
 * Упаковка жадная: файл отрисовывается, пока накопленная оценка ниже бюджета,
 * поэтому последний файл может его превысить. Остальные попадают в список пропущенных.
 */
public final class ContextCompressor {

    private static final Logger log = LoggerFactory.getLogger(ContextCompressor.class);

    /**
     * В режиме SMART файлы длиннее этого числа строк сворачиваются до сигнатур.
     */
    public static final int SMART_LINE_THRESHOLD = 100;

    public static final int CHARS_PER_TOKEN = 4;

    private final SymbolExtractor extractor;

    public ContextCompressor() {
        this(SymbolExtractor.getInstance());
    }

    ContextCompressor(SymbolExtractor extractor) {
        this.extractor = extractor;
    }

    /**
     * @param root корень проекта
     * @param files относительные пути в порядке приоритета
     * @param mode режим отрисовки
     * @param budgetTokens бюджет токенов, больше нуля
     */
    public CompressedContext compress(Path root, List<String> files, CompressionMode mode, int budgetTokens) {
        if (budgetTokens <= 0) {
            throw new CodeMapException(ErrorCode.INVALID_PARAMETER,
                    Map.of("name", "budgetTokens", "value", budgetTokens));
        }

        List<String> rendered = new ArrayList<>();
        List<String> included = new ArrayList<>();
        List<String> omitted = new ArrayList<>();
        int usedChars = 0;

        for (String file : files) {
            if (estimateTokens(usedChars) >= budgetTokens) {
                omitted.add(file);
                continue;
            }
            String block = render(root, RelativePaths.normalize(file), mode);
            rendered.add(block);
            included.add(file);
            usedChars += block.length();
        }

        String content = String.join("\n", rendered);
        if (!omitted.isEmpty()) {
            log.debug("Budget of {} tokens exhausted, {} files omitted", budgetTokens, omitted.size());
        }
        return new CompressedContext(content, included, omitted, estimateTokens(content.length()), mode);
    }

    public static int estimateTokens(int chars) {
        return chars / CHARS_PER_TOKEN;
    }

    private String render(Path root, String file, CompressionMode mode) {
        Path fullPath = root.resolve(file).normalize();
        if (!fullPath.startsWith(root) || !Files.isRegularFile(fullPath)) {
            return "### " + file + " (not found)\n";
        }

        String content;
        try {
            content = EncodingUtils.readTextFile(fullPath).content();
        } catch (IOException e) {
            return "### " + file + " (error: " + e.getMessage() + ")\n";
        }

        boolean signatures = switch (mode) {
            case FULL -> false;
            case SIGNATURES -> true;
            case SMART -> content.split("\n", -1).length > SMART_LINE_THRESHOLD;
        };
        return signatures
                ? renderSignatures(file, content, fullPath)
                : "### " + file + "\n```\n" + content + "\n```\n";
    }

    /**
     * Только строки объявлений из свежего разбора; методы с отступом в четыре пробела.
     */
    private String renderSignatures(String file, String content, Path fullPath) {
        Language language = LanguageDetector.detect(fullPath);
        Optional<ParsedFile> parsed = extractor.parse(content, language);
        if (parsed.isEmpty()) {
            return "### " + file + " (could not parse)\n";
        }

        StringBuilder sb = new StringBuilder("### ").append(file).append(" (signatures only)");
        for (Symbol symbol : parsed.get().symbols()) {
            String line = declarationLine(symbol, language);
            if (line != null) {
                sb.append('\n').append(line);
            }
        }
        return sb.append('\n').toString();
    }

    private static String declarationLine(Symbol symbol, Language language) {
        boolean python = language == Language.PYTHON;
        if (symbol.kind() == SymbolKind.CLASS) {
            if (python) {
                return "class " + symbol.name() + ":";
            }
            return ("interface".equals(symbol.signature()) ? "interface " : "class ") + symbol.name();
        }
        if (symbol.kind().isCallable()) {
            String indent = symbol.parent().isEmpty() ? "" : "    ";
            return indent + (python ? "def " : "function ") + symbol.name() + symbol.signature();
        }
        return null;
    }
}
