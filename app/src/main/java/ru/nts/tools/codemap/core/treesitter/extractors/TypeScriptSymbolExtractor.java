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

import org.treesitter.TSNode;
import ru.nts.tools.codemap.core.treesitter.Import;
import ru.nts.tools.codemap.core.treesitter.Symbol;
import ru.nts.tools.codemap.core.treesitter.SymbolKind;

import java.util.List;
import java.util.Optional;

import static ru.nts.tools.codemap.core.treesitter.SymbolExtractorUtils.*;

/**
 * TypeScript: всё, что умеет JavaScript, плюс абстрактные классы и интерфейсы.
 */
public class TypeScriptSymbolExtractor implements LanguageSymbolExtractor {

    private final JavaScriptSymbolExtractor jsExtractor = new JavaScriptSymbolExtractor();

    @Override
    public Optional<Symbol> extractSymbol(TSNode node, String nodeType, byte[] source, String parentName) {
        Optional<Symbol> jsSymbol = jsExtractor.extractSymbol(node, nodeType, source, parentName);
        if (jsSymbol.isPresent()) return jsSymbol;

        return switch (nodeType) {
            case "abstract_class_declaration" -> jsExtractor.extractClassDeclaration(node, source, parentName);
            case "interface_declaration" -> extractInterfaceDeclaration(node, source, parentName);
            default -> Optional.empty();
        };
    }

    @Override
    public List<Import> extractImports(TSNode node, String nodeType, byte[] source) {
        return jsExtractor.extractImports(node, nodeType, source);
    }

    private Optional<Symbol> extractInterfaceDeclaration(TSNode node, byte[] source, String parentName) {
        TSNode nameNode = fieldChild(node, "name");
        if (nameNode == null) return Optional.empty();

        return Optional.of(new Symbol(
                getNodeText(nameNode, source),
                SymbolKind.CLASS,
                "interface",
                startLine(node),
                endLine(node),
                jsExtractor.extractDoc(node, source),
                parentName));
    }
}
