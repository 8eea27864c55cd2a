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

import ru.nts.tools.codemap.core.treesitter.Language;

import java.util.Set;

/**
 * Ключевые слова и встроенные функции, которые не считаются вызовами.
 */
public final class CallKeywords {

    private CallKeywords() {}

    public static final Set<String> PYTHON = Set.of(
            "if", "elif", "for", "while", "with", "try", "except", "return", "assert",
            "and", "or", "not", "in", "is", "lambda", "yield", "await", "def", "class",
            "print", "len", "str", "int", "float", "bool", "bytes", "list", "dict", "set", "tuple",
            "range", "enumerate", "zip", "map", "filter", "sorted", "reversed", "open",
            "isinstance", "issubclass", "hasattr", "getattr", "setattr", "super", "type",
            "min", "max", "sum", "any", "all", "abs", "repr", "iter", "next"
    );

    public static final Set<String> JAVASCRIPT = Set.of(
            "if", "for", "while", "switch", "catch", "return", "function", "typeof", "instanceof",
            "new", "delete", "void", "await", "yield", "async", "super", "import", "require",
            "constructor", "String", "Number", "Boolean", "Array", "Object", "Symbol",
            "parseInt", "parseFloat", "isNaN", "setTimeout", "setInterval", "clearTimeout"
    );

    public static final Set<String> TYPESCRIPT = Set.of(
            "if", "for", "while", "switch", "catch", "return", "function", "typeof", "instanceof",
            "new", "delete", "void", "await", "yield", "async", "super", "import", "require",
            "constructor", "String", "Number", "Boolean", "Array", "Object", "Symbol",
            "parseInt", "parseFloat", "isNaN", "setTimeout", "setInterval", "clearTimeout",
            "keyof", "satisfies", "as", "Promise", "Record", "Partial", "Readonly"
    );

    public static Set<String> forLanguage(Language language) {
        return switch (language) {
            case PYTHON -> PYTHON;
            case TYPESCRIPT -> TYPESCRIPT;
            case JAVASCRIPT -> JAVASCRIPT;
            default -> Set.of();
        };
    }
}
