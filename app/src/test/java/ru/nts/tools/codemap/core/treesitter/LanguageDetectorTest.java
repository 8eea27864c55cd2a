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

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LanguageDetectorTest {

    @Test
    void detectsParseableLanguages() {
        assertEquals(Language.PYTHON, LanguageDetector.detect(Path.of("src/app.py")));
        assertEquals(Language.PYTHON, LanguageDetector.detect(Path.of("gui.pyw")));
        assertEquals(Language.TYPESCRIPT, LanguageDetector.detect(Path.of("App.tsx")));
        assertEquals(Language.TYPESCRIPT, LanguageDetector.detect(Path.of("mod.mts")));
        assertEquals(Language.JAVASCRIPT, LanguageDetector.detect(Path.of("index.mjs")));
        assertEquals(Language.JAVASCRIPT, LanguageDetector.detect(Path.of("View.JSX")));
    }

    @Test
    void unknownWithoutMappedExtension() {
        assertEquals(Language.UNKNOWN, LanguageDetector.detect(Path.of("Makefile")));
        assertEquals(Language.UNKNOWN, LanguageDetector.detect(Path.of("data.bin")));
        assertEquals(Language.MARKDOWN, LanguageDetector.detect(Path.of("README.md")));
    }

    @Test
    void extensionIsLowerCaseWithDot() {
        assertEquals(".js", LanguageDetector.extensionOf(Path.of("app.min.js")));
        assertEquals(".md", LanguageDetector.extensionOf(Path.of("README.MD")));
        assertEquals("", LanguageDetector.extensionOf(Path.of(".gitignore")));
        assertEquals("", LanguageDetector.extensionOf(Path.of("LICENSE")));
    }

    @Test
    void parseableExtensions() {
        assertTrue(LanguageDetector.PARSEABLE_EXTENSIONS.containsAll(
                Set.of(".py", ".pyw", ".ts", ".tsx", ".mts", ".cts", ".js", ".jsx", ".mjs", ".cjs")));
        assertEquals(10, LanguageDetector.PARSEABLE_EXTENSIONS.size());
        assertTrue(LanguageDetector.isParseable(Path.of("a/b/c.cjs")));
        assertFalse(LanguageDetector.isParseable(Path.of("a/b/c.json")));
    }
}
