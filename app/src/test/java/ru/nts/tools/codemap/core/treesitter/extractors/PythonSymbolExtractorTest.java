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
package ru.nts.tools.codemap.core.treesitter.extractors;

import org.junit.jupiter.api.Test;
import ru.nts.tools.codemap.core.treesitter.Import;
import ru.nts.tools.codemap.core.treesitter.Language;
import ru.nts.tools.codemap.core.treesitter.ParsedFile;
import ru.nts.tools.codemap.core.treesitter.Symbol;
import ru.nts.tools.codemap.core.treesitter.SymbolKind;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PythonSymbolExtractorTest extends AbstractSymbolExtractorTest {

    private static final String SERVICE = """
            import os
            import os.path as osp
            from ..models import User, Group as G
            from . import helpers
            from .utils import *

            class Service(Base):
                \"\"\"Service docstring.\"\"\"

                def run(self, x: int) -> str:
                    def inner():
                        return 1
                    return str(inner())

            def main(argv):
                return Service().run(1)
            """;

    @Test
    void extractsSymbolsInDeclarationOrder() {
        ParsedFile parsed = parse(SERVICE, Language.PYTHON);

        assertEquals(List.of("Service", "run", "inner", "main"),
                parsed.symbols().stream().map(Symbol::name).toList());
        assertValidRanges(parsed);
    }

    @Test
    void extractPythonClass() {
        Symbol service = symbol(parse(SERVICE, Language.PYTHON), "Service");

        assertEquals(SymbolKind.CLASS, service.kind());
        assertEquals("(Base)", service.signature());
        assertEquals("Service docstring.", service.docstring());
        assertEquals("", service.parent());
        assertEquals(7, service.startLine());
        assertEquals(13, service.endLine());
    }

    @Test
    void extractPythonMethodWithReturnAnnotation() {
        Symbol run = symbol(parse(SERVICE, Language.PYTHON), "run");

        assertEquals(SymbolKind.METHOD, run.kind());
        assertEquals("Service", run.parent());
        assertEquals("(self, x: int) -> str", run.signature());
        assertEquals(10, run.startLine());
        assertEquals("Service.run", run.qualifiedName());
    }

    @Test
    void nestedFunctionInsideMethodIsFunction() {
        Symbol inner = symbol(parse(SERVICE, Language.PYTHON), "inner");

        assertEquals(SymbolKind.FUNCTION, inner.kind());
        assertEquals("", inner.parent());
        assertEquals(11, inner.startLine());
        assertEquals(12, inner.endLine());
    }

    @Test
    void extractPythonImports() {
        List<Import> imports = parse(SERVICE, Language.PYTHON).imports();

        assertEquals(5, imports.size());
        assertEquals(new Import("os", List.of(), "", false), imports.get(0));
        assertEquals(new Import("os.path", List.of(), "osp", false), imports.get(1));
        assertEquals(new Import("..models", List.of("User", "Group"), "", true), imports.get(2));
        assertEquals(new Import(".", List.of("helpers"), "", true), imports.get(3));
        assertEquals(new Import(".utils", List.of("*"), "", true), imports.get(4));
    }

    @Test
    void decoratedMethodKeepsClassParent() {
        String code = """
                class Api:
                    @staticmethod
                    def build():
                        '''Builds.'''
                        return Api()
                """;

        Symbol build = symbol(parse(code, Language.PYTHON), "build");

        assertEquals(SymbolKind.METHOD, build.kind());
        assertEquals("Api", build.parent());
        assertEquals("()", build.signature());
        assertEquals("Builds.", build.docstring());
    }

    @Test
    void exportsSkipPrivateNames() {
        String code = """
                def public_api():
                    return _helper()

                def _helper():
                    return 1
                """;

        assertEquals(List.of("public_api"), parse(code, Language.PYTHON).exports());
    }

    @Test
    void syntaxErrorMakesFileUnparseable() {
        String code = """
                def broken(:
                    pass
                """;

        assertTrue(extractor.parse(code, Language.PYTHON).isEmpty());
    }
}
