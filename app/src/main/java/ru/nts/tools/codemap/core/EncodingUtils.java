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
package ru.nts.tools.codemap.core;

import org.mozilla.universalchardet.UniversalDetector;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Утилиты для определения кодировки и безопасного декодирования исходников.
 * Использует UniversalDetector (juniversalchardet) для автоматического определения Charset.
 */
public final class EncodingUtils {

    /**
     * Сколько первых байт проверяется на NULL при детекте бинарных файлов.
     */
    private static final int BINARY_CHECK_LIMIT = 8192;

    private static final Charset FALLBACK_CHARSET = Charset.forName("windows-1251");

    private EncodingUtils() {}

    /**
     * Результат декодирования текстового файла.
     *
     * @param content Содержимое файла в виде строки.
     * @param charset Кодировка, использованная для декодирования байтов.
     */
    public record TextFileContent(String content, Charset charset) {
    }

    /**
     * Считывает текст файла с автоопределением кодировки.
     *
     * @param path Путь к целевому файлу.
     * @return Объект {@link TextFileContent} с текстом файла.
     * @throws IOException Если файл недоступен или является бинарным.
     */
    public static TextFileContent readTextFile(Path path) throws IOException {
        return decode(Files.readAllBytes(path));
    }

    /**
     * Декодирует байты исходника с автоопределением кодировки.
     *
     * @param allBytes содержимое файла
     * @return декодированный текст
     * @throws IOException если содержимое бинарное (содержит NULL байты)
     */
    public static TextFileContent decode(byte[] allBytes) throws IOException {
        Charset charset = detectCharset(allBytes);
        byte[] bytes = stripBom(allBytes, charset);

        // Проверка на бинарный файл (наличие NULL-байтов), кроме многобайтовых кодировок UTF
        if (!charset.name().startsWith("UTF-16") && !charset.name().startsWith("UTF-32")) {
            int checkLimit = Math.min(bytes.length, BINARY_CHECK_LIMIT);
            for (int i = 0; i < checkLimit; i++) {
                if (bytes[i] == 0) {
                    throw new IOException("Binary content detected (contains NULL bytes)");
                }
            }
        }

        return new TextFileContent(new String(bytes, charset), charset);
    }

    private static Charset detectCharset(byte[] allBytes) {
        UniversalDetector detector = new UniversalDetector(null);
        detector.handleData(allBytes, 0, allBytes.length);
        detector.dataEnd();

        String encoding = detector.getDetectedCharset();
        Charset charset = StandardCharsets.UTF_8;

        if (encoding != null) {
            try {
                charset = Charset.forName(encoding);
            } catch (IllegalArgumentException e) {
                charset = StandardCharsets.UTF_8;
            }
        }

        // Детектор часто молчит на коротком ASCII/UTF-8, поэтому проверяем UTF-8 сами
        if (encoding == null || charset.equals(StandardCharsets.UTF_8)) {
            if (!isValidUtf8(allBytes)) {
                charset = FALLBACK_CHARSET;
            }
        }
        return charset;
    }

    private static byte[] stripBom(byte[] allBytes, Charset charset) {
        if (allBytes.length < 2) return allBytes;

        String name = charset.name().toUpperCase();
        if (!name.startsWith("UTF-")) return allBytes;

        int offset = 0;
        if (name.equals("UTF-8")) {
            if (allBytes.length >= 3 && (allBytes[0] & 0xFF) == 0xEF && (allBytes[1] & 0xFF) == 0xBB && (allBytes[2] & 0xFF) == 0xBF) {
                offset = 3;
            }
        } else if (name.equals("UTF-16BE")) {
            if ((allBytes[0] & 0xFF) == 0xFE && (allBytes[1] & 0xFF) == 0xFF) offset = 2;
        } else if (name.equals("UTF-16LE")) {
            if ((allBytes[0] & 0xFF) == 0xFF && (allBytes[1] & 0xFF) == 0xFE) offset = 2;
        }

        if (offset > 0) {
            byte[] withoutBom = new byte[allBytes.length - offset];
            System.arraycopy(allBytes, offset, withoutBom, 0, withoutBom.length);
            return withoutBom;
        }
        return allBytes;
    }

    /**
     * Проверяет, является ли массив байтов валидной последовательностью UTF-8.
     */
    static boolean isValidUtf8(byte[] bytes) {
        int i = 0;
        while (i < bytes.length) {
            int b = bytes[i++] & 0xFF;
            if (b <= 0x7F) continue; // ASCII

            int count;
            if (b >= 0xC2 && b <= 0xDF) count = 1;
            else if (b >= 0xE0 && b <= 0xEF) count = 2;
            else if (b >= 0xF0 && b <= 0xF4) count = 3;
            else return false;

            if (i + count > bytes.length) return false;

            for (int j = 0; j < count; j++) {
                int next = bytes[i++] & 0xFF;
                if (next < 0x80 || next > 0xBF) return false;
            }
        }
        return true;
    }
}
