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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.codemap.core.CodeMapException;
import ru.nts.tools.codemap.core.ErrorCode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты построения индекса символов и графа импортов.
 */
class SymbolIndexBuilderTest {

    @TempDir
    Path root;

    private SymbolIndexBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new SymbolIndexBuilder();
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    @DisplayName("Относительный импорт становится ребром в обе стороны")
    void relativeImportEdge() throws IOException {
        write("pkg/a.py", "from .b import helper\n\ndef main():\n    helper()\n");
        write("pkg/b.py", "def helper():\n    return 1\n");

        SymbolIndex index = builder.build(root);

        assertEquals(Set.of("pkg/b.py"), index.importGraph().importsOf("pkg/a.py"));
        assertEquals(Set.of("pkg/a.py"), index.importGraph().importedBy("pkg/b.py"));
        assertEquals(1, index.importGraph().edgeCount());

        FileDependencies deps = FileDependencies.of(index, "pkg/a.py");
        assertEquals(List.of("pkg/b.py"), deps.imports());
        assertTrue(deps.importedBy().isEmpty());
        assertEquals("main", deps.symbols().get(0).name());
    }

    @Test
    @DisplayName("Граф симметричен")
    void graphIsSymmetric() throws IOException {
        write("web/main.js", "import { x } from './util';\nimport { y } from '../shared/y';\n");
        write("web/util.js", "export function x() {}\n");
        write("shared/y.ts", "import { x } from '../web/util';\nexport const y = () => x();\n");

        ImportGraph graph = builder.build(root).importGraph();

        assertEquals(3, graph.edgeCount());
        graph.allImports().forEach((from, targets) ->
                targets.forEach(to -> assertTrue(graph.importedBy(to).contains(from), from + " -> " + to)));
        graph.allImportedBy().forEach((to, sources) ->
                sources.forEach(from -> assertTrue(graph.importsOf(from).contains(to), from + " -> " + to)));
        assertEquals(Set.of("shared/y.ts", "web/main.js"), graph.importedBy("web/util.js"));
    }

    @Test
    @DisplayName("Повторное построение даёт тот же результат")
    void rebuildIsIdempotent() throws IOException {
        write("a.py", "from .b import f\n\nclass A:\n    def run(self):\n        pass\n");
        write("b.py", "def f():\n    pass\n");

        SymbolIndex first = builder.build(root);
        SymbolIndex second = builder.build(root);

        assertEquals(first.symbolsByFile(), second.symbolsByFile());
        assertEquals(first.importsByFile(), second.importsByFile());
        assertEquals(first.importGraph().allImports(), second.importGraph().allImports());
    }

    @Test
    @DisplayName("Файл с синтаксическими ошибками в индекс не попадает")
    void unparseableFileIsOmitted() throws IOException {
        write("good.py", "def ok():\n    pass\n");
        write("broken.py", "def broken(:\n    pass\n");

        SymbolIndex index = builder.build(root);

        assertEquals(Set.of("good.py"), index.files());
        assertTrue(index.findFirst("broken").isEmpty());
    }

    @Test
    @DisplayName("Неразрешённый импорт не создаёт ребро, но остаётся в списке импортов")
    void unresolvedImportAddsNoEdge() throws IOException {
        write("a.py", "from .missing import x\nimport os\n");

        SymbolIndex index = builder.build(root);

        assertTrue(index.importGraph().importsOf("a.py").isEmpty());
        assertEquals(0, index.importGraph().edgeCount());
        assertEquals(2, index.importsByFile().get("a.py").size());
    }

    @Test
    @DisplayName("Первое вхождение имени в порядке сканирования")
    void firstMatchFollowsScanOrder() throws IOException {
        write("b.py", "def dup():\n    pass\n");
        write("a.py", "def dup():\n    pass\n");
        write("sub/c.py", "def dup():\n    pass\n");

        SymbolIndex index = builder.build(root);

        assertEquals("a.py", index.findFirst("dup").orElseThrow().file());
        assertEquals(List.of("a.py", "b.py", "sub/c.py"),
                index.occurrences("dup").stream().map(SymbolOccurrence::file).toList());
    }

    @Test
    @DisplayName("Неразбираемые расширения не индексируются")
    void onlyParseableFiles() throws IOException {
        write("README.md", "# def fake():\n");
        write("data.json", "{}\n");
        write("app.py", "x = 1\n");

        assertEquals(Set.of("app.py"), builder.build(root).files());
    }

    @Test
    void missingRoot() {
        CodeMapException e = assertThrows(CodeMapException.class, () -> builder.build(root.resolve("absent")));
        assertEquals(ErrorCode.PROJECT_NOT_FOUND, e.getCode());
    }
}
