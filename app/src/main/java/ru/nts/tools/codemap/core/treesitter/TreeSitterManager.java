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

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterTypescript;

import java.util.EnumMap;
import java.util.Map;

/**
 * Менеджер tree-sitter парсеров.
 * Таблица языков создаётся один раз при первом обращении и далее не меняется.
 * TSParser не thread-safe, поэтому у каждого потока свой экземпляр на язык.
 */
public final class TreeSitterManager {

    private static final TreeSitterManager INSTANCE = new TreeSitterManager();

    /**
     * TSLanguage объекты (потокобезопасные, можно переиспользовать).
     */
    private final Map<Language, TSLanguage> languages;

    /**
     * ThreadLocal парсеры для каждого языка.
     */
    private final Map<Language, ThreadLocal<TSParser>> parsers;

    private TreeSitterManager() {
        Map<Language, TSLanguage> langs = new EnumMap<>(Language.class);
        langs.put(Language.PYTHON, new TreeSitterPython());
        langs.put(Language.JAVASCRIPT, new TreeSitterJavascript());
        // .tsx разбирается тем же парсером TypeScript
        langs.put(Language.TYPESCRIPT, new TreeSitterTypescript());
        this.languages = Map.copyOf(langs);

        Map<Language, ThreadLocal<TSParser>> holders = new EnumMap<>(Language.class);
        for (Map.Entry<Language, TSLanguage> entry : languages.entrySet()) {
            TSLanguage tsLanguage = entry.getValue();
            holders.put(entry.getKey(), ThreadLocal.withInitial(() -> {
                TSParser parser = new TSParser();
                parser.setLanguage(tsLanguage);
                return parser;
            }));
        }
        this.parsers = Map.copyOf(holders);
    }

    public static TreeSitterManager getInstance() {
        return INSTANCE;
    }

    /**
     * Проверяет, есть ли парсер для языка.
     */
    public boolean supports(Language language) {
        return languages.containsKey(language);
    }

    /**
     * Парсит строку содержимого и возвращает AST дерево.
     *
     * @param content исходный код
     * @param language язык
     * @return AST дерево
     * @throws IllegalArgumentException если язык не поддерживается
     */
    public TSTree parse(String content, Language language) {
        ThreadLocal<TSParser> holder = parsers.get(language);
        if (holder == null) {
            throw new IllegalArgumentException("Unsupported language: " + language);
        }
        TSTree tree = holder.get().parseString(null, content);
        if (tree == null) {
            throw new IllegalStateException("Failed to parse content for language: " + language);
        }
        return tree;
    }
}
