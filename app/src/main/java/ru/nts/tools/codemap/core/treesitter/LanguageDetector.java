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
package ru.nts.tools.codemap.core.treesitter;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Определяет язык по расширению файла.
 */
public final class LanguageDetector {

    private LanguageDetector() {}

    /**
     * Отображение расширений файлов (без точки) на языки.
     */
    private static final Map<String, Language> EXTENSION_MAP = Map.ofEntries(
            // Python
            Map.entry("py", Language.PYTHON),
            Map.entry("pyw", Language.PYTHON),

            // TypeScript
            Map.entry("ts", Language.TYPESCRIPT),
            Map.entry("tsx", Language.TYPESCRIPT),
            Map.entry("mts", Language.TYPESCRIPT),
            Map.entry("cts", Language.TYPESCRIPT),

            // JavaScript
            Map.entry("js", Language.JAVASCRIPT),
            Map.entry("jsx", Language.JAVASCRIPT),
            Map.entry("mjs", Language.JAVASCRIPT),
            Map.entry("cjs", Language.JAVASCRIPT),

            // Прочее (только статистика)
            Map.entry("json", Language.JSON),
            Map.entry("yaml", Language.YAML),
            Map.entry("yml", Language.YAML),
            Map.entry("md", Language.MARKDOWN),
            Map.entry("txt", Language.TEXT),
            Map.entry("html", Language.HTML),
            Map.entry("css", Language.CSS),
            Map.entry("scss", Language.SCSS),
            Map.entry("sql", Language.SQL),
            Map.entry("sh", Language.SHELL),
            Map.entry("bash", Language.SHELL),
            Map.entry("toml", Language.TOML),
            Map.entry("ini", Language.INI),
            Map.entry("cfg", Language.INI),
            Map.entry("xml", Language.XML),
            Map.entry("go", Language.GO),
            Map.entry("rs", Language.RUST),
            Map.entry("java", Language.JAVA),
            Map.entry("c", Language.C),
            Map.entry("h", Language.C),
            Map.entry("cpp", Language.CPP),
            Map.entry("hpp", Language.CPP)
    );

    /**
     * Расширения (с точкой), которые разбираются в индекс.
     */
    public static final Set<String> PARSEABLE_EXTENSIONS = EXTENSION_MAP.entrySet().stream()
            .filter(e -> e.getValue().isParseable())
            .map(e -> "." + e.getKey())
            .collect(Collectors.toUnmodifiableSet());

    /**
     * Определяет язык по пути к файлу.
     *
     * @param path путь к файлу
     * @return язык или {@link Language#UNKNOWN}
     */
    public static Language detect(Path path) {
        if (path == null || path.getFileName() == null) {
            return Language.UNKNOWN;
        }
        return fromExtension(extensionOf(path));
    }

    /**
     * Определяет язык по расширению (".py" или "py").
     */
    public static Language fromExtension(String extension) {
        if (extension == null || extension.isEmpty()) {
            return Language.UNKNOWN;
        }
        String key = extension.startsWith(".") ? extension.substring(1) : extension;
        return EXTENSION_MAP.getOrDefault(key.toLowerCase(Locale.ROOT), Language.UNKNOWN);
    }

    /**
     * Возвращает расширение в нижнем регистре с точкой, или пустую строку.
     * Для "app.min.js" это ".js", для ".gitignore" пустая строка.
     */
    public static String extensionOf(Path path) {
        String fileName = path.getFileName().toString();
        int dotIndex = fileName.lastIndexOf('.');

        if (dotIndex <= 0 || dotIndex == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dotIndex).toLowerCase(Locale.ROOT);
    }

    public static boolean isParseable(Path path) {
        return PARSEABLE_EXTENSIONS.contains(extensionOf(path));
    }
}
