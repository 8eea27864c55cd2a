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
 * Файл, отобранный под вопрос.
 *
 * @param file относительный путь
 * @param relevanceScore сумма очков: 10 за точное совпадение имени, 5 за частичное, 1 за строку с упоминанием
 * @param matchedSymbols совпавшие символы файла как "kind nameSignature"
 * @param content содержимое, у первых файлов может быть обрезано по бюджету
 */
public record RelevantFile(String file, int relevanceScore, List<String> matchedSymbols, String content) {

    public RelevantFile {
        matchedSymbols = List.copyOf(matchedSymbols);
    }
}
