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
 * Упакованный в бюджет контекст.
 *
 * @param content отрисованные файлы
 * @param filesIncluded файлы, попавшие в content
 * @param filesOmitted файлы, не поместившиеся в бюджет
 * @param estimatedTokens оценка токенов content
 * @param mode режим
 */
public record CompressedContext(
        String content,
        List<String> filesIncluded,
        List<String> filesOmitted,
        int estimatedTokens,
        CompressionMode mode
) {

    public CompressedContext {
        filesIncluded = List.copyOf(filesIncluded);
        filesOmitted = List.copyOf(filesOmitted);
    }
}
