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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.codemap.core.CodeMapException;
import ru.nts.tools.codemap.core.ErrorCode;
import ru.nts.tools.codemap.core.index.SymbolIndex;
import ru.nts.tools.codemap.core.index.SymbolOccurrence;
import ru.nts.tools.codemap.core.treesitter.LanguageDetector;
import ru.nts.tools.codemap.core.treesitter.Symbol;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Текстовый граф вызовов поверх индекса.
 * Вызов распознаётся как идентификатор, за которым следует "(": типы не учитываются.
 * Экземпляр живёт один запрос и не разделяется между потоками.
 */
public final class CallGraphAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CallGraphAnalyzer.class);

    public static final int MAX_CALLEES = 30;
    public static final int MAX_CALLERS = 50;
    public static final int DEFAULT_FLOW_DEPTH = 10;

    /**
     * Сколько вызываемых раскрывается на каждом шаге трассировки.
     */
    public static final int FLOW_FANOUT = 5;

    private static final Pattern CALL_PATTERN = Pattern.compile("\\b([a-zA-Z_][a-zA-Z0-9_]*)\\s*\\(");

    private final SymbolIndex index;

    public CallGraphAnalyzer(SymbolIndex index) {
        this.index = index;
    }

    /**
     * Вызывающие и/или вызываемые для первого определения имени.
     *
     * @param name имя символа
     * @param direction направление
     * @param depth принимается для совместимости интерфейса, списки всегда в один шаг
     * @throws CodeMapException SYMBOL_NOT_FOUND если имени нет в индексе
     */
    public CallGraphResult callGraph(String name, CallDirection direction, int depth) {
        SymbolOccurrence target = index.findFirst(name)
                .orElseThrow(() -> new CodeMapException(ErrorCode.SYMBOL_NOT_FOUND, "symbol", name));

        List<CallerRef> callers = direction.includesCallers() ? findCallers(name) : List.of();
        List<String> callees = direction.includesCallees() ? findCallees(target) : List.of();

        return new CallGraphResult(name, target.file(), target.symbol().startLine(), direction, callers, callees);
    }

    /**
     * Функции и методы, в теле которых встречается {@code name(}.
     */
    public List<CallerRef> findCallers(String name) {
        Pattern pattern = Pattern.compile("\\b" + Pattern.quote(name) + "\\s*\\(");
        List<CallerRef> callers = new ArrayList<>();

        for (String file : index.files()) {
            Optional<String> text = SourceFiles.readText(index.root(), file);
            if (text.isEmpty() || !pattern.matcher(text.get()).find()) {
                continue;
            }
            List<String> lines = text.get().lines().toList();

            for (Symbol symbol : index.symbolsOf(file)) {
                if (!symbol.kind().isCallable() || symbol.name().equals(name)) {
                    continue;
                }
                String body = SourceFiles.slice(lines, symbol.startLine(), symbol.endLine());
                if (pattern.matcher(body).find()) {
                    callers.add(new CallerRef(file, symbol.name(), symbol.startLine()));
                    if (callers.size() >= MAX_CALLERS) {
                        return callers;
                    }
                }
            }
        }
        return callers;
    }

    /**
     * Имена, вызываемые в теле символа, в порядке первого появления.
     */
    public List<String> findCallees(SymbolOccurrence target) {
        Optional<List<String>> lines = SourceFiles.readLines(index.root(), target.file());
        if (lines.isEmpty()) {
            return List.of();
        }

        Symbol symbol = target.symbol();
        String body = SourceFiles.slice(lines.get(), symbol.startLine(), symbol.endLine());
        Set<String> keywords = CallKeywords.forLanguage(LanguageDetector.detect(Path.of(target.file())));

        Set<String> seen = new LinkedHashSet<>();
        Matcher matcher = CALL_PATTERN.matcher(body);
        while (matcher.find() && seen.size() < MAX_CALLEES) {
            String callee = matcher.group(1);
            if (!keywords.contains(callee) && !callee.equals(symbol.name())) {
                seen.add(callee);
            }
        }
        return List.copyOf(seen);
    }

    /**
     * Трассировка в глубину от точки входа.
     * Каждое имя раскрывается не более одного раза, шаги глубже {@code maxDepth} не выводятся,
     * имена без определения становятся внешними листьями.
     *
     * @throws CodeMapException SYMBOL_NOT_FOUND если точки входа нет в индексе
     */
    public FlowTrace traceFlow(String entryPoint, int maxDepth) {
        if (index.findFirst(entryPoint).isEmpty()) {
            throw new CodeMapException(ErrorCode.SYMBOL_NOT_FOUND, "symbol", entryPoint);
        }
        List<FlowStep> steps = new ArrayList<>();
        trace(entryPoint, 0, maxDepth, new HashSet<>(), steps);
        log.debug("Flow from {}: {} steps", entryPoint, steps.size());
        return new FlowTrace(entryPoint, steps);
    }

    private void trace(String name, int depth, int maxDepth, Set<String> visited, List<FlowStep> steps) {
        if (depth > maxDepth || !visited.add(name)) {
            return;
        }

        Optional<SymbolOccurrence> definition = index.findFirst(name);
        if (definition.isEmpty()) {
            steps.add(FlowStep.external(depth, name));
            return;
        }

        Symbol symbol = definition.get().symbol();
        steps.add(new FlowStep(depth, name, definition.get().file(), symbol.startLine(), symbol.signature(), false));

        List<String> callees = findCallees(definition.get());
        for (String callee : callees.subList(0, Math.min(FLOW_FANOUT, callees.size()))) {
            trace(callee, depth + 1, maxDepth, visited, steps);
        }
    }
}
