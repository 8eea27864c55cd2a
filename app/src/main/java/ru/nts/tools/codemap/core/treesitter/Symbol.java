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

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Объявленный символ (функция, метод, класс).
 * Строки 1-based, диапазон включительный и берётся из спана узла AST.
 *
 * @param name имя символа
 * @param kind тип символа
 * @param signature сырой текст параметров/базовых классов, зависит от языка
 * @param startLine начальная строка (1-based)
 * @param endLine конечная строка (1-based, включительно)
 * @param docstring документация, пустая строка если нет
 * @param parent имя объемлющего класса, пустая строка на уровне модуля
 */
public record Symbol(
        String name,
        SymbolKind kind,
        String signature,
        int startLine,
        int endLine,
        String docstring,
        String parent
) {

    public Symbol {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        signature = signature == null ? "" : signature;
        docstring = docstring == null ? "" : docstring;
        parent = parent == null ? "" : parent;

        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException(
                    "Invalid line range " + startLine + "-" + endLine + " for symbol " + name);
        }
        if (kind == SymbolKind.METHOD && parent.isEmpty()) {
            throw new IllegalArgumentException("Method without enclosing class: " + name);
        }
        if (kind == SymbolKind.FUNCTION && !parent.isEmpty()) {
            throw new IllegalArgumentException("Function with enclosing class: " + parent + "." + name);
        }
    }

    /**
     * Возвращает "Parent.name" или просто "name" на уровне модуля.
     */
    public String qualifiedName() {
        return parent.isEmpty() ? name : parent + "." + name;
    }

    /**
     * Приватное имя по соглашению ведущего подчёркивания.
     */
    @JsonIgnore
    public boolean isPrivate() {
        return name.startsWith("_");
    }

    /**
     * Однострочное описание: "kind nameSignature".
     */
    public String summary() {
        return kind + " " + name + signature;
    }

    public boolean containsLine(int line) {
        return line >= startLine && line <= endLine;
    }
}
