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

import java.util.List;
import java.util.Objects;

/**
 * Импорт в том виде, как он написан в файле.
 * Разрешение в конкретный файл хранится отдельно, в графе импортов.
 *
 * @param module модуль как написан ("..models", "./utils", "os.path")
 * @param items именованные импорты, пусто для импорта модуля целиком
 * @param alias псевдоним, пустая строка если нет
 * @param relative true если модуль задан относительно импортирующего файла
 */
public record Import(String module, List<String> items, String alias, boolean relative) {

    public Import {
        Objects.requireNonNull(module, "module");
        items = items == null ? List.of() : List.copyOf(items);
        alias = alias == null ? "" : alias;
    }

    public static Import module(String module, boolean relative) {
        return new Import(module, List.of(), "", relative);
    }
}
