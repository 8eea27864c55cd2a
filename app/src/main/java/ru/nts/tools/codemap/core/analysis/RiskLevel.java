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
 * Грубая оценка радиуса изменения по числу зависимых файлов.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Верхняя граница MEDIUM включительно.
     */
    public static final int MEDIUM_MAX_AFFECTED = 5;

    public static RiskLevel of(int affected) {
        if (affected == 0) {
            return LOW;
        }
        return affected <= MEDIUM_MAX_AFFECTED ? MEDIUM : HIGH;
    }

    public String recommendation(int affected) {
        return switch (this) {
            case LOW -> "Safe to modify. No other files depend on this.";
            case MEDIUM -> "Moderate caution. " + affected
                    + " files may be affected. Review before changing public interfaces.";
            case HIGH -> "High impact. " + affected
                    + " files depend on this. Consider backward compatibility and thorough testing.";
        };
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
