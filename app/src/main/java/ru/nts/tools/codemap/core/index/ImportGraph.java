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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Двунаправленный граф импортов между файлами (относительные пути).
 * {@code importsOf} и {@code importedBy} всегда точные обращения друг друга:
 * рёбра добавляются только через {@link Builder#addEdge}, который обновляет обе стороны.
 */
public final class ImportGraph {

    private final Map<String, Set<String>> importsOf;
    private final Map<String, Set<String>> importedBy;
    private final int edgeCount;

    private ImportGraph(Map<String, Set<String>> importsOf, Map<String, Set<String>> importedBy, int edgeCount) {
        this.importsOf = importsOf;
        this.importedBy = importedBy;
        this.edgeCount = edgeCount;
    }

    /**
     * Файлы, которые импортирует {@code file}, в лексикографическом порядке.
     */
    public Set<String> importsOf(String file) {
        return importsOf.getOrDefault(file, Set.of());
    }

    /**
     * Файлы, которые импортируют {@code file}, в лексикографическом порядке.
     */
    public Set<String> importedBy(String file) {
        return importedBy.getOrDefault(file, Set.of());
    }

    public Map<String, Set<String>> allImports() {
        return importsOf;
    }

    public Map<String, Set<String>> allImportedBy() {
        return importedBy;
    }

    public int edgeCount() {
        return edgeCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Накопитель рёбер на время построения индекса.
     */
    public static final class Builder {

        private final Map<String, Set<String>> importsOf = new LinkedHashMap<>();
        private final Map<String, Set<String>> importedBy = new LinkedHashMap<>();
        private int edgeCount;

        private Builder() {}

        /**
         * Добавляет ребро {@code from -> to} сразу в обе стороны.
         *
         * @return false если ребро уже было
         */
        public boolean addEdge(String from, String to) {
            boolean added = importsOf.computeIfAbsent(from, k -> new TreeSet<>()).add(to);
            importedBy.computeIfAbsent(to, k -> new TreeSet<>()).add(from);
            if (added) {
                edgeCount++;
            }
            return added;
        }

        public ImportGraph build() {
            return new ImportGraph(freeze(importsOf), freeze(importedBy), edgeCount);
        }

        private static Map<String, Set<String>> freeze(Map<String, Set<String>> source) {
            Map<String, Set<String>> copy = new LinkedHashMap<>();
            source.forEach((key, value) -> copy.put(key, Collections.unmodifiableSet(new TreeSet<>(value))));
            return Collections.unmodifiableMap(copy);
        }
    }
}
