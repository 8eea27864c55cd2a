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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Результат разбора одного файла.
 *
 * @param language язык файла
 * @param symbols символы в порядке объявления
 * @param imports импорты в порядке появления
 */
public record ParsedFile(Language language, List<Symbol> symbols, List<Import> imports) {

    public ParsedFile {
        symbols = List.copyOf(symbols);
        imports = List.copyOf(imports);
    }

    /**
     * Имена символов без приватного префикса "_".
     */
    @JsonProperty("exports")
    public List<String> exports() {
        return symbols.stream()
                .filter(s -> !s.isPrivate())
                .map(Symbol::name)
                .toList();
    }
}
