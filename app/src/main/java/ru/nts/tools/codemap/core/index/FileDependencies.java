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
package ru.nts.tools.codemap.core.index;

import ru.nts.tools.codemap.core.treesitter.Symbol;

import java.util.List;

/**
 * Связи одного файла: что он импортирует, кто импортирует его, что в нём объявлено.
 */
public record FileDependencies(String file, List<String> imports, List<String> importedBy, List<Symbol> symbols) {

    public static FileDependencies of(SymbolIndex index, String file) {
        return new FileDependencies(
                file,
                List.copyOf(index.importGraph().importsOf(file)),
                List.copyOf(index.importGraph().importedBy(file)),
                index.symbolsOf(file));
    }
}
