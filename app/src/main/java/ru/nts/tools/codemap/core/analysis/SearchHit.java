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

import com.fasterxml.jackson.annotation.JsonInclude;
import ru.nts.tools.codemap.core.index.SymbolOccurrence;

import java.util.Locale;

/**
 * Результат поиска по ключевым словам: совпадение с именем символа или строка с упоминанием.
 *
 * @param file относительный путь
 * @param line строка определения или упоминания
 * @param matchType вид совпадения
 * @param symbol описание символа, пусто для совпадения по тексту
 * @param content строка с упоминанием, пусто для совпадения по символу
 * @param usageKind классификация упоминания, null для совпадения по символу
 * @param relevance релевантность
 */
public record SearchHit(
        String file,
        int line,
        MatchType matchType,
        String symbol,
        String content,
        @JsonInclude(JsonInclude.Include.NON_NULL) UsageKind usageKind,
        Relevance relevance
) {

    public enum MatchType {
        SYMBOL,
        CONTENT;

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Relevance {
        /** Имя символа совпало с ключевым словом целиком. */
        HIGH,
        MEDIUM;

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    static SearchHit symbol(SymbolOccurrence occurrence, Relevance relevance) {
        return new SearchHit(occurrence.file(), occurrence.symbol().startLine(), MatchType.SYMBOL,
                occurrence.symbol().summary(), "", null, relevance);
    }

    static SearchHit content(Usage usage) {
        return new SearchHit(usage.file(), usage.line(), MatchType.CONTENT,
                "", usage.content(), usage.kind(), Relevance.MEDIUM);
    }
}
