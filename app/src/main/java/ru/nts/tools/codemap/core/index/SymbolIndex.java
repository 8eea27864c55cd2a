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

import ru.nts.tools.codemap.core.treesitter.Import;
import ru.nts.tools.codemap.core.treesitter.Symbol;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Индекс символов проекта. Строится заново на каждый запрос и после построения не меняется.
 *
 * @param root корень проекта
 * @param symbolsByFile символы файла в порядке объявления
 * @param symbolsByName вхождения имени в порядке сканирования
 * @param importsByFile импорты файла как они написаны
 * @param importGraph разрешённые рёбра импортов
 */
public record SymbolIndex(
        Path root,
        Map<String, List<Symbol>> symbolsByFile,
        Map<String, List<SymbolOccurrence>> symbolsByName,
        Map<String, List<Import>> importsByFile,
        ImportGraph importGraph
) {

    public SymbolIndex {
        symbolsByFile = freeze(symbolsByFile);
        symbolsByName = freeze(symbolsByName);
        importsByFile = freeze(importsByFile);
    }

    /**
     * Первое вхождение имени в порядке сканирования.
     * Это детерминированная эвристика, а не разрешение перегрузок.
     */
    public Optional<SymbolOccurrence> findFirst(String name) {
        List<SymbolOccurrence> occurrences = symbolsByName.get(name);
        return occurrences == null || occurrences.isEmpty()
                ? Optional.empty()
                : Optional.of(occurrences.get(0));
    }

    public List<SymbolOccurrence> occurrences(String name) {
        return symbolsByName.getOrDefault(name, List.of());
    }

    public List<Symbol> symbolsOf(String file) {
        return symbolsByFile.getOrDefault(file, List.of());
    }

    /**
     * Разобранные файлы в порядке сканирования.
     */
    public Set<String> files() {
        return symbolsByFile.keySet();
    }

    public int symbolCount() {
        return symbolsByFile.values().stream().mapToInt(List::size).sum();
    }

    private static <V> Map<String, List<V>> freeze(Map<String, List<V>> source) {
        Map<String, List<V>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(copy);
    }
}
