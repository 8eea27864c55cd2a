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

/**
 * Язык файла, определяемый по расширению.
 * Разбираются только языки с {@code parseable = true}, остальные нужны для статистики.
 */
public enum Language {

    PYTHON("python", true, ".py"),
    TYPESCRIPT("typescript", true, ".ts"),
    JAVASCRIPT("javascript", true, ".js"),

    JSON("json", false, ".json"),
    YAML("yaml", false, ".yaml"),
    MARKDOWN("markdown", false, ".md"),
    TEXT("text", false, ".txt"),
    HTML("html", false, ".html"),
    CSS("css", false, ".css"),
    SCSS("scss", false, ".scss"),
    SQL("sql", false, ".sql"),
    SHELL("shell", false, ".sh"),
    TOML("toml", false, ".toml"),
    INI("ini", false, ".ini"),
    XML("xml", false, ".xml"),
    GO("go", false, ".go"),
    RUST("rust", false, ".rs"),
    JAVA("java", false, ".java"),
    C("c", false, ".c"),
    CPP("cpp", false, ".cpp"),
    UNKNOWN("unknown", false, "");

    private final String id;
    private final boolean parseable;
    private final String primaryExtension;

    Language(String id, boolean parseable, String primaryExtension) {
        this.id = id;
        this.parseable = parseable;
        this.primaryExtension = primaryExtension;
    }

    public String getId() {
        return id;
    }

    public boolean isParseable() {
        return parseable;
    }

    /**
     * Основное расширение (с точкой), используется для best-effort путей импортов.
     */
    public String getPrimaryExtension() {
        return primaryExtension;
    }

    @Override
    public String toString() {
        return id;
    }
}
