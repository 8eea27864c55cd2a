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

import ru.nts.tools.codemap.core.treesitter.Import;
import ru.nts.tools.codemap.core.treesitter.Language;
import ru.nts.tools.codemap.core.treesitter.LanguageDetector;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Разрешает относительные импорты в файлы проекта.
 * <p>
 * Python-нотация: N ведущих точек поднимаются на N-1 уровней от директории файла,
 * остаток через точки становится директориями. JS-нотация: "./" остаётся на месте,
 * каждый "../" поднимается на уровень, остаток через "/" становится директориями.
 * Неотносительные импорты не разрешаются.
 */
public final class ImportResolver {

    /**
     * Порядок проверки расширений.
     */
    static final List<String> CANDIDATE_EXTENSIONS = List.of(".py", ".ts", ".tsx", ".js", ".jsx");

    /**
     * Файлы пакета/индекса директории.
     */
    static final List<String> INDEX_FILES = List.of("__init__.py", "index.ts", "index.tsx", "index.js", "index.jsx");

    /**
     * @param root корень проекта
     * @param importingFile относительный путь импортирующего файла
     * @param imp импорт
     * @return найденный файл, best-effort кандидат (exists = false) или пусто
     */
    public Optional<ImportResolution> resolve(Path root, String importingFile, Import imp) {
        if (!imp.relative() || imp.module().isEmpty()) {
            return Optional.empty();
        }

        Language language = LanguageDetector.detect(Path.of(importingFile));
        List<String> base = parentSegments(importingFile);

        Optional<List<String>> target = language == Language.PYTHON
                ? pythonTarget(base, imp.module())
                : jsTarget(base, imp.module());
        if (target.isEmpty()) {
            return Optional.empty();
        }
        List<String> segments = target.get();
        boolean packageRelative = language == Language.PYTHON && isDotsOnly(imp.module());
        // '.', './', '..' и 'lib/' указывают на директорию: только index-файл
        boolean directoryOnly = language != Language.PYTHON && isDirectorySpecifier(imp.module());

        // from . import x: x может быть модулем рядом
        if (packageRelative) {
            for (String item : imp.items()) {
                if (item.equals("*")) continue;
                Optional<String> sibling = lookup(root, append(segments, item), true);
                if (sibling.isPresent()) {
                    return Optional.of(new ImportResolution(sibling.get(), true));
                }
            }
        }

        if (language != Language.PYTHON && !directoryOnly && !segments.isEmpty()) {
            // Явное расширение: './utils.js'
            String exact = join(segments);
            if (Files.isRegularFile(root.resolve(exact))) {
                return Optional.of(new ImportResolution(exact, true));
            }
        }

        Optional<String> found = lookup(root, segments, !directoryOnly);
        if (found.isPresent()) {
            return Optional.of(new ImportResolution(found.get(), true));
        }

        // Ничего не найдено: кандидат с основным расширением языка импортирующего файла
        String primary = language.isParseable() ? language.getPrimaryExtension() : ".py";
        String fallback = segments.isEmpty() || packageRelative || directoryOnly
                ? join(append(segments, language == Language.PYTHON ? "__init__.py" : "index" + primary))
                : join(segments) + primary;
        return Optional.of(new ImportResolution(fallback, false));
    }

    /**
     * Проверяет точные файлы (если разрешено), затем индекс директории.
     */
    private Optional<String> lookup(Path root, List<String> segments, boolean exactFiles) {
        if (exactFiles && !segments.isEmpty()) {
            String target = join(segments);
            for (String ext : CANDIDATE_EXTENSIONS) {
                String candidate = target + ext;
                if (Files.isRegularFile(root.resolve(candidate))) {
                    return Optional.of(candidate);
                }
            }
        }
        for (String indexFile : INDEX_FILES) {
            String candidate = join(append(segments, indexFile));
            if (Files.isRegularFile(root.resolve(candidate))) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private Optional<List<String>> pythonTarget(List<String> base, String module) {
        int dots = 0;
        while (dots < module.length() && module.charAt(dots) == '.') {
            dots++;
        }
        List<String> segments = new ArrayList<>(base);
        for (int i = 0; i < dots - 1; i++) {
            if (segments.isEmpty()) {
                return Optional.empty();
            }
            segments.remove(segments.size() - 1);
        }
        String remainder = module.substring(dots);
        if (!remainder.isEmpty()) {
            for (String part : remainder.split("\\.")) {
                if (!part.isEmpty()) segments.add(part);
            }
        }
        return Optional.of(segments);
    }

    private Optional<List<String>> jsTarget(List<String> base, String module) {
        List<String> segments = new ArrayList<>(base);
        for (String part : module.split("/")) {
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            if (part.equals("..")) {
                if (segments.isEmpty()) {
                    return Optional.empty();
                }
                segments.remove(segments.size() - 1);
            } else {
                segments.add(part);
            }
        }
        return Optional.of(segments);
    }

    private static boolean isDirectorySpecifier(String module) {
        return module.endsWith("/")
                || module.equals(".") || module.equals("..")
                || module.endsWith("/.") || module.endsWith("/..");
    }

    private static boolean isDotsOnly(String module) {
        return module.chars().allMatch(c -> c == '.');
    }

    private static List<String> parentSegments(String relativePath) {
        List<String> parts = new ArrayList<>(Arrays.asList(relativePath.split("/")));
        parts.remove(parts.size() - 1);
        parts.removeIf(String::isEmpty);
        return parts;
    }

    private static List<String> append(List<String> segments, String last) {
        List<String> result = new ArrayList<>(segments);
        result.add(last);
        return result;
    }

    private static String join(List<String> segments) {
        return String.join("/", segments);
    }
}
