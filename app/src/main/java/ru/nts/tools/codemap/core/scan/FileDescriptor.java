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
package ru.nts.tools.codemap.core.scan;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import ru.nts.tools.codemap.core.treesitter.Language;

import java.nio.file.Path;

/**
 * Файл, найденный сканером.
 *
 * @param path абсолютный путь
 * @param relativePath путь относительно корня через "/", каноническая идентичность файла
 * @param extension расширение в нижнем регистре с точкой, пустая строка если нет
 * @param sizeBytes размер в байтах
 * @param language язык по расширению, {@link Language#UNKNOWN} если не известен
 */
public record FileDescriptor(
        @JsonSerialize(using = ToStringSerializer.class) Path path,
        String relativePath,
        String extension,
        long sizeBytes,
        Language language
) {}
