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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.codemap.core.CodeMapException;
import ru.nts.tools.codemap.core.ErrorCode;
import ru.nts.tools.codemap.core.index.SymbolIndex;
import ru.nts.tools.codemap.core.index.SymbolIndexBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты текстового графа вызовов и трассировки потока.
 */
class CallGraphAnalyzerTest {

    private static final String APP = """
            from util import helper


            def main():
                result = helper(2)
                print(result)
            """;

    private static final String UTIL = """
            def helper(x):
                value = compute(x)
                return fmt(value)


            def compute(x):
                return x * 2


            def fmt(v):
                return str(v)
            """;

    @TempDir
    Path root;

    private CallGraphAnalyzer analyzer(String... nameAndContent) throws IOException {
        for (int i = 0; i < nameAndContent.length; i += 2) {
            Files.writeString(root.resolve(nameAndContent[i]), nameAndContent[i + 1]);
        }
        SymbolIndex index = new SymbolIndexBuilder().build(root);
        return new CallGraphAnalyzer(index);
    }

    @Nested
    @DisplayName("Граф вызовов")
    class CallGraphTests {

        @Test
        @DisplayName("Вызывающие helper: только main из app.py")
        void callersOfHelper() throws IOException {
            CallGraphAnalyzer analyzer = analyzer("app.py", APP, "util.py", UTIL);

            assertEquals(List.of(new CallerRef("app.py", "main", 4)), analyzer.findCallers("helper"));
        }

        @Test
        @DisplayName("Вызываемые helper в порядке появления, без самого себя")
        void calleesOfHelper() throws IOException {
            CallGraphResult result = analyzer("app.py", APP, "util.py", UTIL)
                    .callGraph("helper", CallDirection.CALLEES, 3);

            assertEquals("util.py", result.file());
            assertEquals(1, result.line());
            assertEquals(List.of("compute", "fmt"), result.callees());
            assertTrue(result.callers().isEmpty());
        }

        @Test
        @DisplayName("Встроенные имена языка не считаются вызовами")
        void builtinsAreFiltered() throws IOException {
            CallGraphResult result = analyzer("app.py", APP, "util.py", UTIL)
                    .callGraph("main", CallDirection.BOTH, 3);

            assertEquals(List.of("helper"), result.callees());
            assertTrue(result.callers().isEmpty());
        }

        @Test
        @DisplayName("Вызывающих не больше MAX_CALLERS")
        void callersAreCapped() throws IOException {
            StringBuilder source = new StringBuilder("def target():\n    pass\n");
            for (int i = 0; i < 60; i++) {
                source.append("\n\ndef caller").append(i).append("():\n    target()\n");
            }
            CallGraphResult result = analyzer("many.py", source.toString())
                    .callGraph("target", CallDirection.CALLERS, 3);

            assertEquals(CallGraphAnalyzer.MAX_CALLERS, result.callers().size());
            assertEquals("caller0", result.callers().get(0).function());
            assertEquals("caller49", result.callers().get(49).function());
        }

        @Test
        @DisplayName("Вызываемых не больше MAX_CALLEES, в порядке появления")
        void calleesAreCapped() throws IOException {
            StringBuilder source = new StringBuilder("def hub():\n");
            for (int i = 0; i < 40; i++) {
                source.append("    leaf").append(i).append("()\n");
            }
            CallGraphResult result = analyzer("hub.py", source.toString())
                    .callGraph("hub", CallDirection.CALLEES, 3);

            assertEquals(CallGraphAnalyzer.MAX_CALLEES, result.callees().size());
            assertEquals("leaf0", result.callees().get(0));
            assertEquals("leaf29", result.callees().get(29));
        }

        @Test
        void unknownSymbol() throws IOException {
            CallGraphAnalyzer analyzer = analyzer("app.py", APP);

            CodeMapException e = assertThrows(CodeMapException.class,
                    () -> analyzer.callGraph("nothing_here", CallDirection.BOTH, 3));
            assertEquals(ErrorCode.SYMBOL_NOT_FOUND, e.getCode());
            assertEquals("nothing_here", e.getContext().get("symbol"));
        }

        @Test
        @DisplayName("Изолированная функция: пустые списки, не ошибка")
        void isolatedFunction() throws IOException {
            String source = """
                    def lonely(a, b):
                        return a + b
                    """;
            CallGraphResult result = analyzer("app.py", APP, "util.py", UTIL, "lonely.py", source)
                    .callGraph("lonely", CallDirection.BOTH, 3);

            assertTrue(result.callees().isEmpty());
            assertTrue(result.callers().isEmpty());
            assertEquals(CallDirection.BOTH, result.direction());
        }
    }

    @Nested
    @DisplayName("Трассировка потока")
    class FlowTests {

        @Test
        @DisplayName("main -> helper -> compute, fmt")
        void flowFromMain() throws IOException {
            FlowTrace trace = analyzer("app.py", APP, "util.py", UTIL).traceFlow("main", 10);

            assertEquals(List.of("main", "helper", "compute", "fmt"),
                    trace.steps().stream().map(FlowStep::function).toList());
            assertEquals(List.of(0, 1, 2, 2), trace.steps().stream().map(FlowStep::depth).toList());
            assertEquals(4, trace.totalSteps());
            assertEquals("""
                    → main() @ app.py:4
                      → helper() @ util.py:1
                        → compute() @ util.py:6
                        → fmt() @ util.py:10""", trace.render());
        }

        @Test
        @DisplayName("Шаги глубже maxDepth не выводятся")
        void depthLimit() throws IOException {
            FlowTrace trace = analyzer("app.py", APP, "util.py", UTIL).traceFlow("main", 1);

            assertEquals(List.of("main", "helper"), trace.steps().stream().map(FlowStep::function).toList());
        }

        @Test
        @DisplayName("На каждом шаге раскрывается не больше FLOW_FANOUT вызываемых")
        void fanoutLimit() throws IOException {
            StringBuilder source = new StringBuilder("def entry():\n");
            for (int i = 1; i <= 7; i++) {
                source.append("    step").append(i).append("()\n");
            }
            for (int i = 1; i <= 7; i++) {
                source.append("\n\ndef step").append(i).append("():\n    pass\n");
            }
            FlowTrace trace = analyzer("fan.py", source.toString()).traceFlow("entry", 10);

            assertEquals(1 + CallGraphAnalyzer.FLOW_FANOUT, trace.totalSteps());
            assertEquals(List.of("entry", "step1", "step2", "step3", "step4", "step5"),
                    trace.steps().stream().map(FlowStep::function).toList());
        }

        @Test
        @DisplayName("Взаимная рекурсия раскрывается один раз")
        void mutualRecursion() throws IOException {
            String source = """
                    def ping(n):
                        return pong(n - 1)


                    def pong(n):
                        return ping(n - 1)
                    """;
            FlowTrace trace = analyzer("loop.py", source).traceFlow("ping", 10);

            assertEquals(List.of("ping", "pong"), trace.steps().stream().map(FlowStep::function).toList());
        }

        @Test
        @DisplayName("Имя без определения становится внешним листом")
        void externalLeaf() throws IOException {
            String source = """
                    def run():
                        missing_fn()
                    """;
            FlowTrace trace = analyzer("ext.py", source).traceFlow("run", 10);

            FlowStep leaf = trace.steps().get(1);
            assertTrue(leaf.external());
            assertEquals(FlowStep.EXTERNAL_FILE, leaf.file());
            assertEquals("→ run() @ ext.py:1\n  → missing_fn() [external]", trace.render());
        }

        @Test
        void unknownEntryPoint() throws IOException {
            CallGraphAnalyzer analyzer = analyzer("app.py", APP);

            CodeMapException e = assertThrows(CodeMapException.class, () -> analyzer.traceFlow("absent", 10));
            assertEquals(ErrorCode.SYMBOL_NOT_FOUND, e.getCode());
        }
    }
}
