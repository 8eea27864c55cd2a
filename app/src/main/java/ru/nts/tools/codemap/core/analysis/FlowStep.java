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

/**
 * Шаг трассировки потока вызовов.
 *
 * @param depth глубина от точки входа (0 для неё самой)
 * @param function имя функции
 * @param file файл определения или "(external)"
 * @param line строка определения, 0 для внешних
 * @param signature сигнатура определения, пустая для внешних
 * @param external true если определения в индексе нет
 */
public record FlowStep(int depth, String function, String file, int line, String signature, boolean external) {

    public static final String EXTERNAL_FILE = "(external)";

    public static FlowStep external(int depth, String function) {
        return new FlowStep(depth, function, EXTERNAL_FILE, 0, "", true);
    }
}
