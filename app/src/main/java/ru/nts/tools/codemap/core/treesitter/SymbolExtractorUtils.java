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

import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Утилиты для извлечения информации из AST дерева tree-sitter.
 */
public final class SymbolExtractorUtils {

    private SymbolExtractorUtils() {}

    private static final Set<String> COMMENT_TYPES = Set.of(
            "comment", "line_comment", "block_comment", "documentation_comment");

    /**
     * Находит дочерний узел указанного типа.
     */
    public static TSNode findChildByType(TSNode parent, String type) {
        int childCount = parent.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull() && child.getType().equals(type)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Возвращает дочерний узел по имени поля грамматики или null.
     */
    public static TSNode fieldChild(TSNode node, String fieldName) {
        TSNode child = node.getChildByFieldName(fieldName);
        if (child == null || child.isNull()) {
            return null;
        }
        return child;
    }

    /**
     * Извлекает текст узла из байтового массива (корректно для UTF-8).
     * КРИТИЧНО: tree-sitter возвращает байтовые смещения, а не символьные!
     */
    public static String getNodeText(TSNode node, byte[] source) {
        if (node == null) {
            return "";
        }
        int start = node.getStartByte();
        int end = node.getEndByte();
        if (start >= 0 && end <= source.length && start < end) {
            return new String(source, start, end - start, StandardCharsets.UTF_8);
        }
        return "";
    }

    /**
     * Первая строка узла (tree-sitter: 0-based, результат 1-based).
     */
    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * Последняя строка узла, 1-based включительно.
     */
    public static int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }

    /**
     * Извлекает комментарий, предшествующий узлу.
     *
     * @return очищенный текст комментария или пустая строка
     */
    public static String extractPrecedingComment(TSNode node, byte[] source) {
        TSNode prev = node.getPrevSibling();
        if (prev != null && !prev.isNull() && COMMENT_TYPES.contains(prev.getType())) {
            return cleanupComment(getNodeText(prev, source));
        }
        return "";
    }

    /**
     * Очищает комментарий от маркеров.
     */
    public static String cleanupComment(String comment) {
        if (comment == null) return "";
        if (comment.startsWith("/**")) comment = comment.substring(3);
        else if (comment.startsWith("/*")) comment = comment.substring(2);
        if (comment.endsWith("*/")) comment = comment.substring(0, comment.length() - 2);
        if (comment.startsWith("//")) comment = comment.substring(2);
        else if (comment.startsWith("#")) comment = comment.substring(1);

        comment = comment.lines()
                .map(line -> line.replaceFirst("^\\s*\\*\\s?", ""))
                .reduce((a, b) -> a + "\n" + b)
                .orElse("");

        return comment.trim();
    }

    /**
     * Снимает кавычки со строкового литерала: префиксы r/b/u/f, тройные и одинарные кавычки.
     */
    public static String stripStringQuotes(String literal) {
        String text = literal.strip();
        int prefix = 0;
        while (prefix < text.length() && "rRbBuUfF".indexOf(text.charAt(prefix)) >= 0) {
            prefix++;
        }
        text = text.substring(prefix);

        for (String quote : new String[]{"\"\"\"", "'''", "\"", "'", "`"}) {
            if (text.length() >= quote.length() * 2 && text.startsWith(quote) && text.endsWith(quote)) {
                return text.substring(quote.length(), text.length() - quote.length()).strip();
            }
        }
        return text;
    }
}
