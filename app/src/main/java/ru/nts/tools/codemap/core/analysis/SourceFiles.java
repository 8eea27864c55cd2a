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
import ru.nts.tools.codemap.core.EncodingUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Чтение исходников проиндексированных файлов для текстовых анализов.
 */
final class SourceFiles {

    private static final Logger log = LoggerFactory.getLogger(SourceFiles.class);

    private SourceFiles() {}

    /**
     * Текст файла или пусто, если файл не читается (ошибка логируется и поглощается).
     */
    static Optional<String> readText(Path root, String relativePath) {
        try {
            return Optional.of(EncodingUtils.readTextFile(root.resolve(relativePath)).content());
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", relativePath, e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<List<String>> readLines(Path root, String relativePath) {
        return readText(root, relativePath).map(text -> text.lines().toList());
    }

    /**
     * Строки [startLine, endLine] (1-based, включительно), склеенные через перевод строки.
     */
    static String slice(List<String> lines, int startLine, int endLine) {
        int from = Math.max(0, startLine - 1);
        int to = Math.min(lines.size(), endLine);
        if (from >= to) {
            return "";
        }
        return String.join("\n", lines.subList(from, to));
    }
}
