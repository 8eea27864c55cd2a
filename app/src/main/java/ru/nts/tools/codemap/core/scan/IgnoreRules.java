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

import org.eclipse.jgit.ignore.IgnoreNode;
import org.eclipse.jgit.ignore.IgnoreNode.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Правила игнорирования: встроенный список плюс корневой .gitignore.
 * Сопоставление выполняет JGit с семантикой gitignore (*, **, "dir/", отрицание "!",
 * побеждает последнее совпавшее правило).
 */
public final class IgnoreRules {

    private static final Logger log = LoggerFactory.getLogger(IgnoreRules.class);

    /**
     * Встроенные шаблоны, применяются всегда.
     */
    public static final List<String> DEFAULT_IGNORE_PATTERNS = List.of(
            ".git",
            "__pycache__/",
            "*.pyc",
            "node_modules/",
            ".venv/",
            "venv/",
            ".env",
            "dist/",
            "build/",
            "*.egg-info/",
            ".idea/",
            ".vscode/",
            "*.min.js",
            "*.min.css",
            "*.map",
            ".DS_Store",
            "Thumbs.db",
            "*.log",
            "coverage/",
            ".pytest_cache/",
            ".mypy_cache/",
            ".ruff_cache/"
    );

    private final IgnoreNode node;

    private IgnoreRules(List<String> patterns) throws IOException {
        this.node = new IgnoreNode();
        byte[] text = String.join("\n", patterns).getBytes(StandardCharsets.UTF_8);
        node.parse(new ByteArrayInputStream(text));
    }

    /**
     * Загружает правила для корня проекта.
     * Нечитаемый .gitignore не ошибка: используются только встроенные шаблоны.
     */
    public static IgnoreRules load(Path root) {
        List<String> patterns = new ArrayList<>(DEFAULT_IGNORE_PATTERNS);
        Path gitignore = root.resolve(".gitignore");
        if (Files.isRegularFile(gitignore)) {
            try {
                for (String line : Files.readAllLines(gitignore, StandardCharsets.UTF_8)) {
                    String trimmed = line.strip();
                    if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                        patterns.add(trimmed);
                    }
                }
            } catch (IOException e) {
                log.debug("Cannot read {}: {}", gitignore, e.getMessage());
            }
        }
        return of(patterns);
    }

    /**
     * Правила из явного списка шаблонов.
     */
    public static IgnoreRules of(List<String> patterns) {
        try {
            return new IgnoreRules(patterns);
        } catch (IOException e) {
            // Чтение из массива байт не бросает IOException
            throw new IllegalStateException("Failed to parse ignore patterns", e);
        }
    }

    /**
     * Проверяет путь относительно корня (через "/").
     *
     * @param relativePath относительный путь
     * @param directory true для директорий (шаблоны "dir/" совпадают только с ними)
     */
    public boolean isIgnored(String relativePath, boolean directory) {
        return node.isIgnored(relativePath, directory) == MatchResult.IGNORED;
    }
}
