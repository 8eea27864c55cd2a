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

import ru.nts.tools.codemap.core.index.RelativePaths;
import ru.nts.tools.codemap.core.index.SymbolIndex;
import ru.nts.tools.codemap.core.treesitter.Symbol;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Прямые и косвенные (через один уровень) зависимые файла по графу импортов.
 */
public final class ChangeImpactAnalyzer {

    private final SymbolIndex index;

    public ChangeImpactAnalyzer(SymbolIndex index) {
        this.index = index;
    }

    /**
     * @param file путь относительно корня
     * @throws ru.nts.tools.codemap.core.CodeMapException FILE_NOT_FOUND если файла нет на диске
     */
    public ImpactReport analyze(String file) {
        String relPath = RelativePaths.normalize(file);
        RelativePaths.requireFile(index.root(), relPath);

        Set<String> direct = index.importGraph().importedBy(relPath);

        Set<String> indirect = new TreeSet<>();
        for (String dependent : direct) {
            for (String transitive : index.importGraph().importedBy(dependent)) {
                if (!transitive.equals(relPath) && !direct.contains(transitive)) {
                    indirect.add(transitive);
                }
            }
        }

        List<String> exported = index.symbolsOf(relPath).stream()
                .filter(s -> !s.isPrivate())
                .map(Symbol::summary)
                .toList();

        int totalAffected = direct.size() + indirect.size();
        RiskLevel risk = RiskLevel.of(totalAffected);

        return new ImpactReport(
                relPath,
                exported,
                List.copyOf(direct),
                List.copyOf(indirect),
                totalAffected,
                risk,
                risk.recommendation(totalAffected));
    }
}
