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

import java.util.List;

/**
 * Последствия изменения файла.
 *
 * @param file анализируемый файл
 * @param symbolsExported публичные символы файла как "kind nameSignature"
 * @param directDependents файлы, импортирующие его напрямую
 * @param indirectDependents файлы, импортирующие прямых зависимых (без пересечения с ними)
 * @param totalAffected сумма прямых и косвенных
 * @param riskLevel уровень риска
 * @param recommendation текстовая рекомендация
 */
public record ImpactReport(
        String file,
        List<String> symbolsExported,
        List<String> directDependents,
        List<String> indirectDependents,
        int totalAffected,
        RiskLevel riskLevel,
        String recommendation
) {

    public ImpactReport {
        symbolsExported = List.copyOf(symbolsExported);
        directDependents = List.copyOf(directDependents);
        indirectDependents = List.copyOf(indirectDependents);
    }
}
