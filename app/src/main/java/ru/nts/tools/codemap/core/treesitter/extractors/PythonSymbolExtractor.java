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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static ru.nts.tools.codemap.core.treesitter.SymbolExtractorUtils.*;

public class PythonSymbolExtractor implements LanguageSymbolExtractor {

    @Override
    public Optional<Symbol> extractSymbol(TSNode node, String nodeType, byte[] source, String parentName) {
        return switch (nodeType) {
            case "function_definition" -> extractFunction(node, source, parentName);
            case "class_definition" -> extractClass(node, source, parentName);
            default -> Optional.empty();
        };
    }

    @Override
    public List<Import> extractImports(TSNode node, String nodeType, byte[] source) {
        return switch (nodeType) {
            case "import_statement" -> extractImportStatement(node, source);
            case "import_from_statement" -> List.of(extractFromImport(node, source, fieldText(node, "module_name", source)));
            case "future_import_statement" -> List.of(extractFromImport(node, source, "__future__"));
            default -> List.of();
        };
    }

    private Optional<Symbol> extractFunction(TSNode node, byte[] source, String parentName) {
        TSNode nameNode = fieldChild(node, "name");
        if (nameNode == null) return Optional.empty();

        String signature = fieldText(node, "parameters", source);
        TSNode returnType = fieldChild(node, "return_type");
        if (returnType != null) {
            signature += " -> " + getNodeText(returnType, source);
        }

        SymbolKind kind = parentName.isEmpty() ? SymbolKind.FUNCTION : SymbolKind.METHOD;
        return Optional.of(new Symbol(
                getNodeText(nameNode, source),
                kind,
                signature,
                startLine(node),
                endLine(node),
                extractDocstring(node, source),
                parentName));
    }

    private Optional<Symbol> extractClass(TSNode node, byte[] source, String parentName) {
        TSNode nameNode = fieldChild(node, "name");
        if (nameNode == null) return Optional.empty();

        return Optional.of(new Symbol(
                getNodeText(nameNode, source),
                SymbolKind.CLASS,
                fieldText(node, "superclasses", source),
                startLine(node),
                endLine(node),
                extractDocstring(node, source),
                parentName));
    }

    /**
     * Docstring: первое выражение-строка в теле.
     */
    private String extractDocstring(TSNode node, byte[] source) {
        TSNode body = fieldChild(node, "body");
        if (body == null || body.getNamedChildCount() == 0) {
            return "";
        }
        TSNode first = body.getNamedChild(0);
        if (first == null || first.isNull() || !first.getType().equals("expression_statement")) {
            return "";
        }
        TSNode expr = first.getNamedChildCount() > 0 ? first.getNamedChild(0) : null;
        if (expr == null || expr.isNull() || !expr.getType().equals("string")) {
            return "";
        }
        return stripStringQuotes(getNodeText(expr, source));
    }

    // ===================== ИМПОРТЫ =====================

    /**
     * import a.b, c as d: по одному Import на каждое имя.
     */
    private List<Import> extractImportStatement(TSNode node, byte[] source) {
        List<Import> imports = new ArrayList<>();
        int count = node.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getNamedChild(i);
            if (child == null || child.isNull()) continue;

            switch (child.getType()) {
                case "dotted_name" -> imports.add(Import.module(getNodeText(child, source), false));
                case "aliased_import" -> imports.add(new Import(
                        fieldText(child, "name", source),
                        List.of(),
                        fieldText(child, "alias", source),
                        false));
                default -> { }
            }
        }
        return imports;
    }

    /**
     * from M import x, y as z / from M import * / from . import x
     */
    private Import extractFromImport(TSNode node, byte[] source, String module) {
        List<String> items = new ArrayList<>();
        boolean afterImportKeyword = false;

        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (child == null || child.isNull()) continue;

            String type = child.getType();
            if (!afterImportKeyword) {
                afterImportKeyword = type.equals("import");
                continue;
            }
            switch (type) {
                case "dotted_name" -> items.add(getNodeText(child, source));
                case "aliased_import" -> items.add(fieldText(child, "name", source));
                case "wildcard_import" -> items.add("*");
                default -> { }
            }
        }
        return new Import(module, items, "", module.startsWith("."));
    }

    private static String fieldText(TSNode node, String field, byte[] source) {
        TSNode child = fieldChild(node, field);
        return child == null ? "" : getNodeText(child, source);
    }
}
