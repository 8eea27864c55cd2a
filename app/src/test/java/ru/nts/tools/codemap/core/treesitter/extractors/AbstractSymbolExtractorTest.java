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

import org.junit.jupiter.api.BeforeEach;
import ru.nts.tools.codemap.core.treesitter.Language;
import ru.nts.tools.codemap.core.treesitter.ParsedFile;
import ru.nts.tools.codemap.core.treesitter.Symbol;
import ru.nts.tools.codemap.core.treesitter.SymbolExtractor;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

public abstract class AbstractSymbolExtractorTest {

    protected SymbolExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = SymbolExtractor.getInstance();
    }

    protected ParsedFile parse(String code, Language language) {
        return extractor.parse(code, language)
                .orElseThrow(() -> new AssertionError("Expected parseable " + language + " code"));
    }

    protected Symbol symbol(ParsedFile parsed, String name) {
        return parsed.symbols().stream()
                .filter(s -> s.name().equals(name))
                .findFirst()
                .orElseGet(() -> fail("Symbol not found: " + name + " in " + parsed.symbols()));
    }

    protected void assertValidRanges(ParsedFile parsed) {
        for (Symbol s : parsed.symbols()) {
            assertTrue(s.startLine() >= 1 && s.startLine() <= s.endLine(), "Bad range for " + s);
        }
    }
}
