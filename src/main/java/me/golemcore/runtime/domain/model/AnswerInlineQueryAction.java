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

import java.util.List;
import java.util.Objects;

/**
 * Answer an inline query with a list of article results.
 *
 * @param queryId
 *            query being answered
 * @param results
 *            results to show, at most 50
 * @param cacheTimeSeconds
 *            how long the platform may cache the answer, {@code null} for the
 *            platform default
 * @param personal
 *            cache the answer per user instead of globally
 * @param nextOffset
 *            offset to request the next page with, {@code null} when there are no
 *            more results
 */
@Builder
public record AnswerInlineQueryAction(InlineQueryId queryId, List<InlineArticle> results, Integer cacheTimeSeconds,
        boolean personal, String nextOffset) implements Action {

    public AnswerInlineQueryAction {
        Objects.requireNonNull(queryId, "queryId");
        results = results == null ? List.of() : List.copyOf(results);
    }

    @Override
    public String describe() {
        return "answerInlineQuery(query=" + queryId + ", " + results.size() + " results)";
    }
}
