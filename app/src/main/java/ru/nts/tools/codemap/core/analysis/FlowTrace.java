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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Результат трассировки от точки входа, шаги в порядке обхода в глубину.
 */
public record FlowTrace(String entryPoint, List<FlowStep> steps) {

    public FlowTrace {
        steps = List.copyOf(steps);
    }

    @JsonProperty("totalSteps")
    public int totalSteps() {
        return steps.size();
    }

    /**
     * Текстовое дерево: два пробела на уровень.
     * <pre>
     * → main() @ app.py:1
     *   → helper() @ util.py:3
     *   → print_result() [external]
     * </pre>
     */
    @JsonProperty("flowText")
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (FlowStep step : steps) {
            if (sb.length() > 0) sb.append('\n');
            sb.append("  ".repeat(step.depth())).append("→ ").append(step.function()).append("()");
            if (step.external()) {
                sb.append(" [external]");
            } else {
                sb.append(" @ ").append(step.file()).append(':').append(step.line());
            }
        }
        return sb.toString();
    }
}
