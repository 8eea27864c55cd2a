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

import java.util.List;

/**
 * Вызывающие и вызываемые для одного символа (один шаг).
 *
 * @param function имя символа
 * @param file файл первого определения
 * @param line строка первого определения
 * @param direction запрошенное направление
 * @param callers вызывающие, пусто если не запрашивались
 * @param callees вызываемые имена в порядке первого появления, пусто если не запрашивались
 */
public record CallGraphResult(
        String function,
        String file,
        int line,
        CallDirection direction,
        List<CallerRef> callers,
        List<String> callees
) {

    public CallGraphResult {
        callers = List.copyOf(callers);
        callees = List.copyOf(callees);
    }
}
