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

import java.util.List;
import java.util.Optional;

/**
 * Интерфейс для извлечения символов и импортов для конкретного языка.
 */
public interface LanguageSymbolExtractor {

    /**
     * Извлекает символ из узла AST.
     *
     * @param node       Текущий узел AST
     * @param nodeType   Тип узла (передается для оптимизации, чтобы не вызывать node.getType() лишний раз)
     * @param source     Содержимое файла в UTF-8
     * @param parentName Имя объемлющего класса, пустая строка вне класса
     * @return Optional с символом, если узел является объявлением
     */
    Optional<Symbol> extractSymbol(TSNode node, String nodeType, byte[] source, String parentName);

    /**
     * Извлекает импорты, которые объявляет узел.
     */
    List<Import> extractImports(TSNode node, String nodeType, byte[] source);
}
