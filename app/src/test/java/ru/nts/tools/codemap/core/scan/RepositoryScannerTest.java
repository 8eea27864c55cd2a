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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.codemap.core.CodeMapException;
import ru.nts.tools.codemap.core.ErrorCode;
import ru.nts.tools.codemap.core.treesitter.Language;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты обхода репозитория.
 */
class RepositoryScannerTest {

    @TempDir
    Path root;

    private void write(String relativePath, String content) throws IOException {
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private List<String> scan(int maxDepth) {
        return new RepositoryScanner(root, maxDepth).scan()
                .map(FileDescriptor::relativePath)
                .toList();
    }

    @Nested
    @DisplayName("Правила игнорирования")
    class IgnoreRulesTests {

        @Test
        @DisplayName("Встроенные шаблоны отсекают служебные директории и файлы")
        void defaultPatterns() throws IOException {
            write("app.py", "x = 1\n");
            write("node_modules/lib/index.js", "");
            write("__pycache__/app.cpython-311.pyc", "");
            write("build/out.js", "");
            write("web/app.min.js", "");
            write("web/app.js", "");
            write("server.log", "");
            write("pkg.egg-info/PKG-INFO", "");

            assertEquals(List.of("app.py", "web/app.js"), scan(15));
        }

        @Test
        @DisplayName("Скрытые директории не обходятся")
        void hiddenDirectoriesArePruned() throws IOException {
            write(".hidden/secret.py", "");
            write(".git/config", "");
            write("visible.py", "");

            assertEquals(List.of("visible.py"), scan(15));
        }

        @Test
        @DisplayName(".gitignore дополняет встроенные шаблоны, отрицание возвращает файл")
        void gitignoreMergeAndNegation() throws IOException {
            write(".gitignore", "# comment\n\ngenerated/\n*.tmp\n!keep.log\n");
            write("generated/models.py", "");
            write("scratch.tmp", "");
            write("keep.log", "");
            write("drop.log", "");
            write("main.py", "");

            List<String> files = scan(15);

            assertTrue(files.contains("keep.log"));
            assertTrue(files.contains("main.py"));
            assertFalse(files.contains("drop.log"));
            assertFalse(files.contains("scratch.tmp"));
            assertFalse(files.contains("generated/models.py"));
        }

        @Test
        @DisplayName("Шаблон директории с ** совпадает на любой глубине")
        void doubleStarPattern() throws IOException {
            write(".gitignore", "**/fixtures/\n");
            write("a/b/fixtures/data.py", "");
            write("a/b/real.py", "");

            assertEquals(List.of(".gitignore", "a/b/real.py"), scan(15));
        }
    }

    @Nested
    @DisplayName("Границы обхода")
    class BoundsTests {

        @Test
        @DisplayName("Директории глубже maxDepth не обходятся")
        void depthLimit() throws IOException {
            write("top.py", "");
            write("d1/one.py", "");
            write("d1/d2/two.py", "");

            assertEquals(List.of("top.py", "d1/one.py"), scan(1));
            assertEquals(List.of("top.py"), scan(0));
        }

        @Test
        @DisplayName("Файлы больше 1 000 000 байт пропускаются")
        void sizeLimit() throws IOException {
            Files.write(root.resolve("huge.py"), new byte[(int) RepositoryScanner.MAX_FILE_SIZE + 1]);
            Files.write(root.resolve("edge.py"), new byte[(int) RepositoryScanner.MAX_FILE_SIZE]);

            assertEquals(List.of("edge.py"), scan(15));
        }

        @Test
        @DisplayName("Несуществующий корень даёт PROJECT_NOT_FOUND")
        void missingRoot() {
            CodeMapException e = assertThrows(CodeMapException.class,
                    () -> new RepositoryScanner(root.resolve("nope"), 15));
            assertEquals(ErrorCode.PROJECT_NOT_FOUND, e.getCode());
        }

        @Test
        @DisplayName("Файл вместо корня даёт PROJECT_NOT_FOUND")
        void fileAsRoot() throws IOException {
            write("file.py", "");
            CodeMapException e = assertThrows(CodeMapException.class,
                    () -> new RepositoryScanner(root.resolve("file.py"), 15));
            assertEquals(ErrorCode.PROJECT_NOT_FOUND, e.getCode());
        }
    }

    @Test
    @DisplayName("Порядок: файлы директории по имени, затем поддиректории по имени")
    void deterministicOrder() throws IOException {
        write("b.py", "");
        write("a.py", "");
        write("z/inner.py", "");
        write("m/inner.py", "");

        assertEquals(List.of("a.py", "b.py", "m/inner.py", "z/inner.py"), scan(15));
    }

    @Test
    @DisplayName("Фильтр расширений и поля FileDescriptor")
    void extensionFilterAndDescriptor() throws IOException {
        write("src/app.ts", "let a = 1;\n");
        write("README.md", "# readme\n");

        List<FileDescriptor> files = new RepositoryScanner(root, 15).scan(Set.of(".ts")).toList();

        assertEquals(1, files.size());
        FileDescriptor file = files.get(0);
        assertEquals("src/app.ts", file.relativePath());
        assertEquals(".ts", file.extension());
        assertEquals(11, file.sizeBytes());
        assertEquals(Language.TYPESCRIPT, file.language());
        assertTrue(file.path().isAbsolute());
    }
}
