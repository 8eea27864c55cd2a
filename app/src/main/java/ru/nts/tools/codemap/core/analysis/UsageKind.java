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

import java.util.Locale;

/**
 * Классификация строки с упоминанием имени. Правила проверяются по порядку, первое совпавшее побеждает.
 */
public enum UsageKind {
    DEFINITION,
    IMPORT,
    CALL,
    ATTRIBUTE,
    ASSIGNMENT,
    REFERENCE;

    public static UsageKind classify(String line, String name) {
        String text = line.strip();

        if ((text.startsWith("def ") || text.startsWith("async def ")) && text.contains(name + "(")) {
            return DEFINITION;
        }
        if (text.startsWith("class ") && text.contains(name)) {
            return DEFINITION;
        }
        if (text.contains("import") && text.contains(name)) {
            return IMPORT;
        }
        if (text.contains(name + "(")) {
            return CALL;
        }
        if (text.contains("." + name)) {
            return ATTRIBUTE;
        }
        if (text.contains(name + " =") || text.contains(name + ":")) {
            return ASSIGNMENT;
        }
        return REFERENCE;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
