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

import ru.nts.tools.codemap.core.index.SymbolIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Поиск всех упоминаний имени по границам слова в проиндексированных файлах.
 */
public final class UsageFinder {

    public static final int MAX_CONTENT_LENGTH = 150;

    private final SymbolIndex index;

    public UsageFinder(SymbolIndex index) {
        this.index = index;
    }

    public List<Usage> findUsages(String name) {
        Pattern pattern = Pattern.compile("\\b" + Pattern.quote(name) + "\\b");
        List<Usage> usages = new ArrayList<>();

        for (String file : index.files()) {
            Optional<List<String>> lines = SourceFiles.readLines(index.root(), file);
            if (lines.isEmpty()) {
                continue;
            }
            for (int i = 0; i < lines.get().size(); i++) {
                String line = lines.get().get(i);
                if (!pattern.matcher(line).find()) {
                    continue;
                }
                String content = line.strip();
                if (content.length() > MAX_CONTENT_LENGTH) {
                    content = content.substring(0, MAX_CONTENT_LENGTH);
                }
                usages.add(new Usage(file, i + 1, content, UsageKind.classify(line, name)));
            }
        }
        return usages;
    }
}
