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
import ru.nts.tools.codemap.core.ErrorCode;
import ru.nts.tools.codemap.core.index.SymbolIndex;
import ru.nts.tools.codemap.core.index.SymbolOccurrence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Отбор файлов, относящихся к вопросу, в бюджет токенов.
 * <p>
 * Файлы оцениваются по совпадениям ключевых слов с именами символов и по упоминаниям в тексте,
 * затем берутся по убыванию оценки (не больше {@link #MAX_FILES}) целиком, пока хватает бюджета.
 * Первые {@link #MIN_FILES} файла при нехватке бюджета обрезаются, а не пропускаются.
 */
public final class SmartContextFinder {

    private static final Logger log = LoggerFactory.getLogger(SmartContextFinder.class);

    public static final int DEFAULT_MAX_TOKENS = 15_000;

    static final int MAX_FILES = 20;
    static final int MIN_FILES = 3;

    static final int EXACT_MATCH_SCORE = 10;
    static final int PARTIAL_MATCH_SCORE = 5;
    static final int USAGE_SCORE = 1;

    private final SymbolIndex index;

    public SmartContextFinder(SymbolIndex index) {
        this.index = index;
    }

    /**
     * @param question вопрос на естественном языке
     * @param maxTokens бюджет токенов, больше нуля
     */
    public SmartContext find(String question, int maxTokens) {
        if (maxTokens <= 0) {
            throw new CodeMapException(ErrorCode.INVALID_PARAMETER, Map.of("name", "maxTokens", "value", maxTokens));
        }
        List<String> keywords = QueryKeywords.extract(question);

        // Порядок вставки решает при равных оценках
        Map<String, Integer> scores = new LinkedHashMap<>();
        Map<String, Set<String>> matchedSymbols = new HashMap<>();

        for (String keyword : keywords) {
            String needle = keyword.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, List<SymbolOccurrence>> entry : index.symbolsByName().entrySet()) {
                String name = entry.getKey().toLowerCase(Locale.ROOT);
                if (!name.contains(needle)) {
                    continue;
                }
                int score = name.equals(needle) ? EXACT_MATCH_SCORE : PARTIAL_MATCH_SCORE;
                for (SymbolOccurrence occurrence : entry.getValue()) {
                    scores.merge(occurrence.file(), score, Integer::sum);
                    matchedSymbols.computeIfAbsent(occurrence.file(), k -> new LinkedHashSet<>())
                            .add(occurrence.symbol().summary());
                }
            }
        }

        UsageFinder usageFinder = new UsageFinder(index);
        for (String keyword : keywords) {
            for (Usage usage : usageFinder.findUsages(keyword)) {
                scores.merge(usage.file(), USAGE_SCORE, Integer::sum);
            }
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(scores.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue().reversed());

        int maxChars = maxTokens * ContextCompressor.CHARS_PER_TOKEN;
        int totalChars = 0;
        List<RelevantFile> files = new ArrayList<>();

        for (Map.Entry<String, Integer> entry : ranked.subList(0, Math.min(MAX_FILES, ranked.size()))) {
            Optional<String> text = SourceFiles.readText(index.root(), entry.getKey());
            if (text.isEmpty()) {
                continue;
            }
            String content = text.get();
            if (totalChars + content.length() > maxChars) {
                if (files.size() >= MIN_FILES) {
                    continue;
                }
                content = content.substring(0, maxChars - totalChars);
            }
            totalChars += content.length();
            files.add(new RelevantFile(entry.getKey(), entry.getValue(),
                    new ArrayList<>(matchedSymbols.getOrDefault(entry.getKey(), Set.of())), content));
            if (totalChars >= maxChars) {
                break;
            }
        }

        log.debug("Smart context for {}: {} scored, {} selected", keywords, scores.size(), files.size());
        return new SmartContext(question, keywords, scores.size(), files, ContextCompressor.estimateTokens(totalChars));
    }
}
