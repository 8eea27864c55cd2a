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

import ru.nts.tools.codemap.core.CodeMapException;
import ru.nts.tools.codemap.core.ErrorCode;
import ru.nts.tools.codemap.core.index.SymbolIndex;
import ru.nts.tools.codemap.core.index.SymbolOccurrence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Поиск кода по вопросу: ключевые слова сопоставляются с именами символов (подстрока,
 * без учёта регистра), затем с текстом файлов по границам слова.
 * <p>
 * Совпадение имени целиком даёт HIGH, остальное MEDIUM. Каждый файл попадает в выдачу по символу
 * не больше одного раза; по тексту берутся первые {@link #USAGES_PER_KEYWORD} строк на слово.
 */
public final class SymbolSearch {

    public static final int DEFAULT_TOP_K = 10;

    static final int USAGES_PER_KEYWORD = 5;

    private static final Comparator<SearchHit> RANKING = Comparator
            .comparing(SearchHit::relevance)
            .thenComparing(SearchHit::matchType);

    private final SymbolIndex index;

    public SymbolSearch(SymbolIndex index) {
        this.index = index;
    }

    /**
     * @param query вопрос или набор слов
     * @param topK сколько результатов вернуть, больше нуля
     * @return результаты: сначала HIGH, внутри уровня символы раньше текста
     */
    public List<SearchHit> search(String query, int topK) {
        if (topK <= 0) {
            throw new CodeMapException(ErrorCode.INVALID_PARAMETER, Map.of("name", "topK", "value", topK));
        }
        List<String> keywords = QueryKeywords.extract(query);
        Set<String> seen = new HashSet<>();
        List<SearchHit> hits = new ArrayList<>();

        for (String keyword : keywords) {
            String needle = keyword.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, List<SymbolOccurrence>> entry : index.symbolsByName().entrySet()) {
                String name = entry.getKey().toLowerCase(Locale.ROOT);
                if (!name.contains(needle)) {
                    continue;
                }
                SearchHit.Relevance relevance = name.equals(needle) ? SearchHit.Relevance.HIGH : SearchHit.Relevance.MEDIUM;
                for (SymbolOccurrence occurrence : entry.getValue()) {
                    if (seen.add(occurrence.file())) {
                        hits.add(SearchHit.symbol(occurrence, relevance));
                    }
                }
            }
        }

        UsageFinder usageFinder = new UsageFinder(index);
        for (String keyword : keywords) {
            List<Usage> usages = usageFinder.findUsages(keyword);
            for (Usage usage : usages.subList(0, Math.min(USAGES_PER_KEYWORD, usages.size()))) {
                if (seen.add(usage.file() + ":" + usage.line())) {
                    hits.add(SearchHit.content(usage));
                }
            }
        }

        // List.sort стабилен: внутри группы сохраняется порядок находок
        hits.sort(RANKING);
        return List.copyOf(hits.subList(0, Math.min(topK, hits.size())));
    }
}
