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
 * Результат запроса к движку: либо значение, либо структурированная ошибка.
 * Исключения за границу {@link CodeMapEngine} не выходят.
 *
 * @param value результат (null при ошибке)
 * @param error описание ошибки (null при успехе)
 */
public record QueryResult<T>(T value, ErrorInfo error) {

    public static <T> QueryResult<T> ok(T value) {
        return new QueryResult<>(value, null);
    }

    public static <T> QueryResult<T> failure(CodeMapException e) {
        return new QueryResult<>(null, ErrorInfo.from(e));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Возвращает значение или бросает исходную ошибку заново.
     */
    public T orElseThrow() {
        if (error != null) {
            throw new CodeMapException(error.code(), error.context());
        }
        return value;
    }

    /**
     * Структурированное описание ошибки.
     *
     * @param code код ошибки
     * @param message короткое сообщение
     * @param solution подсказка с подставленным контекстом
     * @param context контекст (path, symbol и т.д.)
     */
    public record ErrorInfo(ErrorCode code, String message, String solution, Map<String, Object> context) {

        public static ErrorInfo from(CodeMapException e) {
            return new ErrorInfo(e.getCode(), e.getCode().getMessage(),
                    e.getCode().resolveSolution(e.getContext()), e.getContext());
        }
    }
}
