package me.golemcore.runtime.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;

import java.util.Objects;

/**
 * Acknowledge a callback query, optionally showing a notification or alert.
 */
@Builder
public record AnswerCallbackQueryAction(CallbackQueryId queryId, String text, boolean showAlert, String url,
        Integer cacheTimeSeconds) implements Action {

    public AnswerCallbackQueryAction {
        Objects.requireNonNull(queryId, "queryId");
    }

    public static AnswerCallbackQueryAction acknowledge(CallbackQueryId queryId) {
        return AnswerCallbackQueryAction.builder().queryId(queryId).build();
    }

    public static AnswerCallbackQueryAction notify(CallbackQueryId queryId, String text) {
        return AnswerCallbackQueryAction.builder().queryId(queryId).text(text).build();
    }

    @Override
    public String describe() {
        return "answerCallbackQuery(query=" + queryId + ")";
    }
}
