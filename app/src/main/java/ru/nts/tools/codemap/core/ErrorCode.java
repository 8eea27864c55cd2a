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

import java.util.Map;

/**
 * Structured error codes for CodeMap queries.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example of a rendered error:
 * <pre>
 * [ERROR: SYMBOL_NOT_FOUND]
 * Message: Symbol not found
 * Solution: No definition named 'proces' in the index. Check spelling or run 'usages'.
 * Context: symbol=proces
 * </pre>
 */
public enum ErrorCode {

    // ============ NotFound ============

    PROJECT_NOT_FOUND("Project path does not exist",
            "Check the project root '%root%'. Pass --root or set CODEMAP_ROOT."),

    FILE_NOT_FOUND("File not found",
            "No file '%path%' under the project root. Paths are repo-relative with '/' separators."),

    SYMBOL_NOT_FOUND("Symbol not found",
            "No definition named '%symbol%' in the index. Check spelling or run 'usages'."),

    // ============ Parsing ============

    UNPARSEABLE_FILE("File could not be parsed",
            "'%path%' has syntax errors, binary content or an unsupported language. It is left out of the index."),

    // ============ Parameters ============

    INVALID_PARAMETER("Invalid parameter",
            "Parameter '%name%' has an unsupported value '%value%'."),

    // ============ External ============

    EXTERNAL_TOOL_FAILURE("External tool failed",
            "The external command did not complete. Check that it is installed and the project is a repository."),

    // ============ System ============

    INTERNAL_ERROR("Internal error",
            "Unexpected error. Check logs for details.");

    private final String message;
    private final String solution;

    ErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Подставляет значения контекста в плейсхолдеры %key% подсказки.
     * Неиспользованные плейсхолдеры заменяются на "...".
     */
    public String resolveSolution(Map<String, Object> context) {
        String resolved = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolved = resolved.replace("%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        return resolved.replaceAll("%\\w+%", "...");
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (path, symbol, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));
        sb.append(String.format("Solution: %s", resolveSolution(context)));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }
        return sb.toString();
    }
}
