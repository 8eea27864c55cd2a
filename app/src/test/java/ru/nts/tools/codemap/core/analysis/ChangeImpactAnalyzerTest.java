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
package ru.nts.tools.codemap.core.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.codemap.core.CodeMapException;
import ru.nts.tools.codemap.core.ErrorCode;
import ru.nts.tools.codemap.core.index.SymbolIndexBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangeImpactAnalyzerTest {

    @TempDir
    Path root;

    private void write(String name, String content) throws IOException {
        Files.writeString(root.resolve(name), content);
    }

    private ImpactReport analyze(String file) {
        return new ChangeImpactAnalyzer(new SymbolIndexBuilder().build(root)).analyze(file);
    }

    @Test
    @DisplayName("Шесть импортирующих файлов дают HIGH")
    void sixDependentsIsHighRisk() throws IOException {
        write("core.py", "def shared():\n    pass\n");
        for (int i = 1; i <= 6; i++) {
            write("user" + i + ".py", "from .core import shared\n");
        }

        ImpactReport report = analyze("core.py");

        assertEquals(6, report.directDependents().size());
        assertEquals(6, report.totalAffected());
        assertEquals(RiskLevel.HIGH, report.riskLevel());
        assertEquals("high", report.riskLevel().toString());
        assertTrue(report.recommendation().startsWith("High impact. 6 files"));
    }

    @Test
    @DisplayName("Цепочка: косвенный зависимый через один уровень")
    void chain() throws IOException {
        write("c.py", "def base():\n    pass\n");
        write("b.py", "from .c import base\n");
        write("a.py", "from .b import base\n");

        ImpactReport report = analyze("c.py");

        assertEquals(List.of("b.py"), report.directDependents());
        assertEquals(List.of("a.py"), report.indirectDependents());
        assertEquals(2, report.totalAffected());
        assertEquals(RiskLevel.MEDIUM, report.riskLevel());
    }

    @Test
    @DisplayName("Прямые и косвенные не пересекаются")
    void directAndIndirectAreDisjoint() throws IOException {
        write("c.py", "def base():\n    pass\n");
        write("b.py", "from .c import base\n");
        write("a.py", "from .b import base\nfrom .c import base\n");

        ImpactReport report = analyze("c.py");

        assertEquals(List.of("a.py", "b.py"), report.directDependents());
        assertTrue(report.indirectDependents().isEmpty());
        assertEquals(2, report.totalAffected());
    }

    @Test
    @DisplayName("Цикл не возвращает сам файл")
    void cycle() throws IOException {
        write("x.py", "from .y import b\n\ndef a():\n    pass\n");
        write("y.py", "from .x import a\n\ndef b():\n    pass\n");

        ImpactReport report = analyze("x.py");

        assertEquals(List.of("y.py"), report.directDependents());
        assertTrue(report.indirectDependents().isEmpty());
        assertEquals(1, report.totalAffected());
    }

    @Test
    @DisplayName("Файл без зависимых и список публичных символов")
    void lowRiskAndExportedSymbols() throws IOException {
        write("models.py", """
                class Model:
                    def save(self):
                        pass


                def public_fn(a, b):
                    pass


                def _private():
                    pass
                """);

        ImpactReport report = analyze("./models.py");

        assertEquals("models.py", report.file());
        assertEquals(RiskLevel.LOW, report.riskLevel());
        assertEquals("Safe to modify. No other files depend on this.", report.recommendation());
        assertTrue(report.symbolsExported().contains("method save(self)"), report.symbolsExported().toString());
        assertTrue(report.symbolsExported().contains("function public_fn(a, b)"), report.symbolsExported().toString());
        assertTrue(report.symbolsExported().stream().noneMatch(s -> s.contains("_private")));
    }

    @Test
    void missingFile() throws IOException {
        write("a.py", "x = 1\n");

        CodeMapException e = assertThrows(CodeMapException.class, () -> analyze("ghost.py"));
        assertEquals(ErrorCode.FILE_NOT_FOUND, e.getCode());
    }

    @Test
    @DisplayName("Границы уровней риска")
    void riskBoundaries() {
        assertEquals(RiskLevel.LOW, RiskLevel.of(0));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.of(1));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.of(5));
        assertEquals(RiskLevel.HIGH, RiskLevel.of(6));
        assertEquals("medium", RiskLevel.MEDIUM.toString());
        assertEquals("Moderate caution. 3 files may be affected. Review before changing public interfaces.",
                RiskLevel.MEDIUM.recommendation(3));
    }
}
