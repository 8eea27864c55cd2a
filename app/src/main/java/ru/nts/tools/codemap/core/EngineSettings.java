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
package ru.nts.tools.codemap.core;

import java.nio.file.Path;
import java.util.Map;

/**
 * Настройки движка из переменных окружения.
 * <ul>
 *   <li>CODEMAP_ROOT - корень проекта (по умолчанию текущая директория)</li>
 *   <li>CODEMAP_MAX_DEPTH - глубина обхода директорий (по умолчанию 15)</li>
 *   <li>CODEMAP_DEBUG - подробное логирование</li>
 * </ul>
 * Пороги алгоритмов (размер файла, лимиты, уровни риска) сюда не входят:
 * это константы соответствующих компонентов.
 */
public record EngineSettings(Path projectRoot, int maxDepth, boolean debug) {

    public static final int DEFAULT_MAX_DEPTH = 15;

    public EngineSettings {
        projectRoot = projectRoot.toAbsolutePath().normalize();
        if (maxDepth < 0) {
            throw new CodeMapException(ErrorCode.INVALID_PARAMETER,
                    Map.of("name", "maxDepth", "value", maxDepth));
        }
    }

    public static EngineSettings defaults(Path projectRoot) {
        return new EngineSettings(projectRoot, DEFAULT_MAX_DEPTH, false);
    }

    /**
     * Читает настройки из переданного окружения.
     */
    public static EngineSettings fromEnvironment(Map<String, String> env) {
        String root = env.get("CODEMAP_ROOT");
        Path projectRoot = (root != null && !root.isBlank())
                ? Path.of(root)
                : Path.of(System.getProperty("user.dir"));

        int maxDepth = DEFAULT_MAX_DEPTH;
        String depth = env.get("CODEMAP_MAX_DEPTH");
        if (depth != null && !depth.isBlank()) {
            try {
                maxDepth = Integer.parseInt(depth.trim());
            } catch (NumberFormatException e) {
                throw new CodeMapException(ErrorCode.INVALID_PARAMETER,
                        Map.of("name", "CODEMAP_MAX_DEPTH", "value", depth), e);
            }
        }

        boolean debug = "true".equalsIgnoreCase(env.get("CODEMAP_DEBUG"));
        return new EngineSettings(projectRoot, maxDepth, debug);
    }

    public EngineSettings withProjectRoot(Path root) {
        return new EngineSettings(root, maxDepth, debug);
    }
}
