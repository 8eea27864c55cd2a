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

import ru.nts.tools.codemap.core.CodeMapException;
import ru.nts.tools.codemap.core.ErrorCode;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Нормализация путей, которые приходят от пользователя.
 */
public final class RelativePaths {

    private RelativePaths() {}

    /**
     * Приводит путь к виду индекса: "/" как разделитель, без ведущего "./".
     */
    public static String normalize(String path) {
        String normalized = path.strip().replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    /**
     * Разрешает путь относительно корня и проверяет, что файл существует внутри проекта.
     *
     * @return абсолютный путь к файлу
     * @throws CodeMapException FILE_NOT_FOUND если файла нет или путь выходит за корень
     */
    public static Path requireFile(Path root, String relativePath) {
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root) || !Files.isRegularFile(resolved)) {
            throw new CodeMapException(ErrorCode.FILE_NOT_FOUND, "path", relativePath);
        }
        return resolved;
    }
}
