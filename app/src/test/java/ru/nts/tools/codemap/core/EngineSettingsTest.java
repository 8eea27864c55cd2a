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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineSettingsTest {

    @Test
    void readsEnvironment(@TempDir Path root) {
        EngineSettings settings = EngineSettings.fromEnvironment(Map.of(
                "CODEMAP_ROOT", root.toString(),
                "CODEMAP_MAX_DEPTH", " 4 ",
                "CODEMAP_DEBUG", "TRUE"));

        assertEquals(root.toAbsolutePath().normalize(), settings.projectRoot());
        assertEquals(4, settings.maxDepth());
        assertTrue(settings.debug());
    }

    @Test
    void defaultsWhenUnset() {
        EngineSettings settings = EngineSettings.fromEnvironment(Map.of());

        assertEquals(Path.of(System.getProperty("user.dir")).toAbsolutePath().normalize(), settings.projectRoot());
        assertEquals(EngineSettings.DEFAULT_MAX_DEPTH, settings.maxDepth());
        assertFalse(settings.debug());
    }

    @Test
    void invalidDepth() {
        CodeMapException notANumber = assertThrows(CodeMapException.class,
                () -> EngineSettings.fromEnvironment(Map.of("CODEMAP_MAX_DEPTH", "deep")));
        assertEquals(ErrorCode.INVALID_PARAMETER, notANumber.getCode());
        assertEquals("CODEMAP_MAX_DEPTH", notANumber.getContext().get("name"));

        assertThrows(CodeMapException.class,
                () -> EngineSettings.fromEnvironment(Map.of("CODEMAP_MAX_DEPTH", "-1")));
    }

    @Test
    void rootOverrideKeepsOtherSettings(@TempDir Path root) {
        EngineSettings settings = new EngineSettings(Path.of("."), 3, true).withProjectRoot(root);

        assertEquals(root.toAbsolutePath().normalize(), settings.projectRoot());
        assertEquals(3, settings.maxDepth());
        assertTrue(settings.debug());
    }
}
