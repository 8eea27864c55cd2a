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
package ru.nts.tools.codemap.core.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Статистика репозитория по выдаче сканера.
 *
 * @param totalFiles число файлов
 * @param totalLines суммарное число строк
 * @param languages файлов на язык
 * @param fileTypes файлов на расширение ("no_extension" для файлов без расширения)
 */
public record RepoStats(int totalFiles, long totalLines, Map<String, Integer> languages, Map<String, Integer> fileTypes) {

    private static final Logger log = LoggerFactory.getLogger(RepoStats.class);

    public static final String NO_EXTENSION = "no_extension";

    public RepoStats {
        languages = Collections.unmodifiableMap(new TreeMap<>(languages));
        fileTypes = Collections.unmodifiableMap(new TreeMap<>(fileTypes));
    }

    /**
     * Собирает статистику, поглощая поток файлов.
     */
    public static RepoStats collect(Stream<FileDescriptor> files) {
        int totalFiles = 0;
        long totalLines = 0;
        Map<String, Integer> languages = new TreeMap<>();
        Map<String, Integer> fileTypes = new TreeMap<>();

        Iterable<FileDescriptor> iterable = files::iterator;
        for (FileDescriptor file : iterable) {
            totalFiles++;
            languages.merge(file.language().getId(), 1, Integer::sum);
            fileTypes.merge(file.extension().isEmpty() ? NO_EXTENSION : file.extension(), 1, Integer::sum);

            try {
                totalLines += countLines(Files.readAllBytes(file.path()));
            } catch (IOException e) {
                log.debug("Cannot read {}: {}", file.relativePath(), e.getMessage());
            }
        }
        return new RepoStats(totalFiles, totalLines, languages, fileTypes);
    }

    /**
     * Число строк: переводы строк плюс последняя строка без перевода.
     */
    static long countLines(byte[] bytes) {
        long lines = 0;
        for (byte b : bytes) {
            if (b == '\n') lines++;
        }
        if (bytes.length > 0 && bytes[bytes.length - 1] != '\n') {
            lines++;
        }
        return lines;
    }
}
