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
 * Строка файла, где встречается имя.
 *
 * @param file относительный путь
 * @param line номер строки (1-based)
 * @param content строка без отступов, не длиннее {@link UsageFinder#MAX_CONTENT_LENGTH}
 * @param kind классификация
 */
public record Usage(String file, int line, String content, UsageKind kind) {}
