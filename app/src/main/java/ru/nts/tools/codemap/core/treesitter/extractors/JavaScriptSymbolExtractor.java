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
import java.util.Set;

import static ru.nts.tools.codemap.core.treesitter.SymbolExtractorUtils.*;

public class JavaScriptSymbolExtractor implements LanguageSymbolExtractor {

    /**
     * Значения переменной, которые делают её функцией.
     */
    private static final Set<String> FUNCTION_VALUE_TYPES = Set.of(
            "arrow_function", "function_expression", "function", "generator_function");

    @Override
    public Optional<Symbol> extractSymbol(TSNode node, String nodeType, byte[] source, String parentName) {
        return switch (nodeType) {
            case "function_declaration", "generator_function_declaration" -> extractFunctionDeclaration(node, source);
            case "class_declaration" -> extractClassDeclaration(node, source, parentName);
            case "method_definition" -> extractMethodDefinition(node, source, parentName);
            case "variable_declarator" -> extractFunctionVariable(node, source);
            default -> Optional.empty();
        };
    }

    @Override
    public List<Import> extractImports(TSNode node, String nodeType, byte[] source) {
        return switch (nodeType) {
            case "import_statement" -> extractImportStatement(node, source);
            case "export_statement" -> extractReExport(node, source);
            case "call_expression" -> extractRequireCall(node, source);
            default -> List.of();
        };
    }

    private Optional<Symbol> extractFunctionDeclaration(TSNode node, byte[] source) {
        TSNode nameNode = fieldChild(node, "name");
        if (nameNode == null) return Optional.empty();

        return Optional.of(new Symbol(
                getNodeText(nameNode, source),
                SymbolKind.FUNCTION,
                extractParameters(node, source),
                startLine(node),
                endLine(node),
                extractDoc(node, source),
                ""));
    }

    protected Optional<Symbol> extractClassDeclaration(TSNode node, byte[] source, String parentName) {
        TSNode nameNode = fieldChild(node, "name");
        if (nameNode == null) return Optional.empty();

        TSNode heritage = findChildByType(node, "class_heritage");
        return Optional.of(new Symbol(
                getNodeText(nameNode, source),
                SymbolKind.CLASS,
                heritage == null ? "" : getNodeText(heritage, source),
                startLine(node),
                endLine(node),
                extractDoc(node, source),
                parentName));
    }

    /**
     * Метод внутри класса, либо функция, если объемлющего класса нет (методы объектных литералов).
     */
    private Optional<Symbol> extractMethodDefinition(TSNode node, byte[] source, String parentName) {
        TSNode nameNode = fieldChild(node, "name");
        if (nameNode == null) return Optional.empty();

        SymbolKind kind = parentName.isEmpty() ? SymbolKind.FUNCTION : SymbolKind.METHOD;
        return Optional.of(new Symbol(
                getNodeText(nameNode, source),
                kind,
                extractParameters(node, source),
                startLine(node),
                endLine(node),
                extractPrecedingComment(node, source),
                parentName));
    }

    /**
     * const name = (...) => {...} / const name = function (...) {...}
     */
    private Optional<Symbol> extractFunctionVariable(TSNode node, byte[] source) {
        TSNode nameNode = fieldChild(node, "name");
        TSNode value = fieldChild(node, "value");
        if (nameNode == null || value == null
                || !nameNode.getType().equals("identifier")
                || !FUNCTION_VALUE_TYPES.contains(value.getType())) {
            return Optional.empty();
        }

        // Комментарий стоит перед объявлением (или перед export), а не перед declarator
        TSNode declaration = node.getParent();
        return Optional.of(new Symbol(
                getNodeText(nameNode, source),
                SymbolKind.FUNCTION,
                extractParameters(value, source),
                startLine(node),
                endLine(node),
                declaration == null || declaration.isNull() ? "" : extractDoc(declaration, source),
                ""));
    }

    /**
     * Текст параметров вместе с аннотацией возвращаемого типа, если она есть.
     */
    protected String extractParameters(TSNode node, byte[] source) {
        TSNode params = fieldChild(node, "parameters");
        String signature;
        if (params != null) {
            signature = getNodeText(params, source);
        } else {
            // x => x * 2
            TSNode single = fieldChild(node, "parameter");
            signature = single == null ? "()" : "(" + getNodeText(single, source) + ")";
        }
        TSNode returnType = fieldChild(node, "return_type");
        if (returnType != null) {
            signature += getNodeText(returnType, source);
        }
        return signature;
    }

    /**
     * Комментарий перед объявлением; для export-объявлений он стоит перед export.
     */
    protected String extractDoc(TSNode node, byte[] source) {
        String doc = extractPrecedingComment(node, source);
        if (!doc.isEmpty()) {
            return doc;
        }
        TSNode parent = node.getParent();
        if (parent != null && !parent.isNull() && parent.getType().equals("export_statement")) {
            return extractPrecedingComment(parent, source);
        }
        return "";
    }

    // ===================== ИМПОРТЫ =====================

    /**
     * import x, { a, b as c } from './m' / import * as ns from 'm' / import './side-effect'
     */
    private List<Import> extractImportStatement(TSNode node, byte[] source) {
        TSNode sourceNode = fieldChild(node, "source");
        if (sourceNode == null) return List.of();

        String module = stripStringQuotes(getNodeText(sourceNode, source));
        List<String> items = new ArrayList<>();
        String alias = "";

        TSNode clause = findChildByType(node, "import_clause");
        if (clause != null) {
            int count = clause.getNamedChildCount();
            for (int i = 0; i < count; i++) {
                TSNode child = clause.getNamedChild(i);
                if (child == null || child.isNull()) continue;

                switch (child.getType()) {
                    case "identifier" -> items.add(getNodeText(child, source));
                    case "named_imports" -> collectSpecifierNames(child, "import_specifier", source, items);
                    case "namespace_import" -> {
                        TSNode id = findChildByType(child, "identifier");
                        if (id != null) alias = getNodeText(id, source);
                    }
                    default -> { }
                }
            }
        }
        return List.of(new Import(module, items, alias, isRelativeSpecifier(module)));
    }

    /**
     * export { a } from './m' / export * from './m' / export * as ns from './m'
     */
    private List<Import> extractReExport(TSNode node, byte[] source) {
        TSNode sourceNode = fieldChild(node, "source");
        if (sourceNode == null) return List.of();

        String module = stripStringQuotes(getNodeText(sourceNode, source));
        List<String> items = new ArrayList<>();
        String alias = "";

        TSNode clause = findChildByType(node, "export_clause");
        if (clause != null) {
            collectSpecifierNames(clause, "export_specifier", source, items);
        }
        TSNode namespace = findChildByType(node, "namespace_export");
        if (namespace != null) {
            TSNode id = namespace.getNamedChildCount() > 0 ? namespace.getNamedChild(0) : null;
            if (id != null && !id.isNull()) alias = getNodeText(id, source);
        } else if (findChildByType(node, "*") != null) {
            items.add("*");
        }
        return List.of(new Import(module, items, alias, isRelativeSpecifier(module)));
    }

    /**
     * require('m') и динамический import('m') со строковым литералом.
     */
    private List<Import> extractRequireCall(TSNode node, byte[] source) {
        TSNode function = fieldChild(node, "function");
        TSNode arguments = fieldChild(node, "arguments");
        if (function == null || arguments == null) return List.of();

        boolean isRequire = function.getType().equals("identifier")
                && getNodeText(function, source).equals("require");
        boolean isDynamicImport = function.getType().equals("import");
        if (!isRequire && !isDynamicImport) return List.of();

        TSNode first = arguments.getNamedChildCount() > 0 ? arguments.getNamedChild(0) : null;
        if (first == null || first.isNull() || !first.getType().equals("string")) return List.of();

        String module = stripStringQuotes(getNodeText(first, source));
        return List.of(Import.module(module, isRelativeSpecifier(module)));
    }

    private void collectSpecifierNames(TSNode container, String specifierType, byte[] source, List<String> items) {
        int count = container.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode specifier = container.getNamedChild(i);
            if (specifier == null || specifier.isNull() || !specifier.getType().equals(specifierType)) continue;
            TSNode name = fieldChild(specifier, "name");
            items.add(getNodeText(name != null ? name : specifier, source));
        }
    }

    static boolean isRelativeSpecifier(String module) {
        return module.startsWith("./") || module.startsWith("../") || module.equals(".") || module.equals("..");
    }
}
