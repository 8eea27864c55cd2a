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
 * Подборка файлов под вопрос.
 *
 * @param question исходный вопрос
 * @param keywordsDetected выделенные ключевые слова
 * @param filesAnalyzed сколько файлов получили ненулевую оценку
 * @param relevantFiles отобранные файлы по убыванию оценки
 * @param totalTokensEstimate оценка токенов всего содержимого
 */
public record SmartContext(
        String question,
        List<String> keywordsDetected,
        int filesAnalyzed,
        List<RelevantFile> relevantFiles,
        int totalTokensEstimate
) {

    public SmartContext {
        keywordsDetected = List.copyOf(keywordsDetected);
        relevantFiles = List.copyOf(relevantFiles);
    }
}
