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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryKeywordsTest {

    @Test
    @DisplayName("Стоп-слова и короткие слова отбрасываются")
    void dropsStopWordsAndShortWords() {
        assertEquals(List.of("authentication", "token"),
                QueryKeywords.extract("How does the authentication work with a token?"));
        assertEquals(List.of(), QueryKeywords.extract("Explain this code to me, if it is OK"));
    }

    @Test
    @DisplayName("Порядок первого появления, без повторов, регистр сохраняется")
    void keepsFirstAppearanceOrder() {
        assertEquals(List.of("UserService", "save_user", "userservice"),
                QueryKeywords.extract("UserService.save_user and UserService or userservice"));
    }

    @Test
    @DisplayName("Идентификатор не начинается с цифры")
    void identifiersOnly() {
        assertEquals(List.of("parse_v2", "_private"), QueryKeywords.extract("parse_v2 2fast _private"));
    }
}
