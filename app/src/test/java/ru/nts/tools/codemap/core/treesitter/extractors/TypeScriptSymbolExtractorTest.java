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

class TypeScriptSymbolExtractorTest extends AbstractSymbolExtractorTest {

    private static final String HANDLERS = """
            import { Request } from './types';

            export interface Handler {
              handle(req: Request): void;
            }

            export abstract class BaseHandler implements Handler {
              abstract handle(req: Request): void;

              protected log(message: string): void {
                console.log(message);
              }
            }

            export function create(name: string): BaseHandler | null {
              return null;
            }
            """;

    @Test
    void interfaceIsClassWithInterfaceSignature() {
        Symbol handler = symbol(parse(HANDLERS, Language.TYPESCRIPT), "Handler");

        assertEquals(SymbolKind.CLASS, handler.kind());
        assertEquals("interface", handler.signature());
        assertEquals(3, handler.startLine());
        assertEquals(5, handler.endLine());
    }

    @Test
    void abstractClassAndItsMethods() {
        ParsedFile parsed = parse(HANDLERS, Language.TYPESCRIPT);

        Symbol base = symbol(parsed, "BaseHandler");
        assertEquals(SymbolKind.CLASS, base.kind());

        Symbol log = symbol(parsed, "log");
        assertEquals(SymbolKind.METHOD, log.kind());
        assertEquals("BaseHandler", log.parent());
        assertTrue(log.signature().startsWith("(message: string)"), log.signature());

        // Абстрактные сигнатуры без тела не являются объявлениями
        assertTrue(parsed.symbols().stream().noneMatch(s -> s.name().equals("handle")));
    }

    @Test
    void exportedFunctionWithReturnType() {
        Symbol create = symbol(parse(HANDLERS, Language.TYPESCRIPT), "create");

        assertEquals(SymbolKind.FUNCTION, create.kind());
        assertTrue(create.signature().startsWith("(name: string)"), create.signature());
        assertTrue(create.signature().contains("BaseHandler | null"), create.signature());
    }

    @Test
    void extractTsImports() {
        List<Import> imports = parse(HANDLERS, Language.TYPESCRIPT).imports();

        assertEquals(List.of(new Import("./types", List.of("Request"), "", true)), imports);
    }
}
