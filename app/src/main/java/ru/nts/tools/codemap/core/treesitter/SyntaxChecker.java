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
package ru.nts.tools.codemap.core.treesitter;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверка синтаксиса через tree-sitter AST.
 * Ищет ERROR и MISSING узлы в дереве разбора.
 */
public final class SyntaxChecker {

    private static final int MAX_ERRORS = 5;

    private SyntaxChecker() {}

    public record SyntaxError(int line, int column, String message) {}

    public record SyntaxCheckResult(List<SyntaxError> errors) {
        public boolean hasErrors() { return !errors.isEmpty(); }
    }

    /**
     * Собирает первые ошибки разбора в дереве.
     *
     * @param root корневой узел
     * @return результат проверки
     */
    public static SyntaxCheckResult check(TSNode root) {
        List<SyntaxError> errors = new ArrayList<>();
        collectErrors(root, errors);
        return new SyntaxCheckResult(List.copyOf(errors));
    }

    private static void collectErrors(TSNode node, List<SyntaxError> errors) {
        if (errors.size() >= MAX_ERRORS) return;

        if (node.getType().equals("ERROR") || node.isMissing()) {
            int line = node.getStartPoint().getRow() + 1;
            int column = node.getStartPoint().getColumn() + 1;

            String message;
            if (node.isMissing()) {
                message = "Missing expected syntax: " + node.getType();
            } else {
                TSNode parent = node.getParent();
                String parentType = (parent != null && !parent.isNull()) ? parent.getType() : "unknown";
                message = "Syntax error in " + parentType;
            }

            errors.add(new SyntaxError(line, column, message));
            return; // Не рекурсим в ERROR-узлы
        }

        int childCount = node.getChildCount();
        for (int i = 0; i < childCount && errors.size() < MAX_ERRORS; i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull()) {
                collectErrors(child, errors);
            }
        }
    }
}
