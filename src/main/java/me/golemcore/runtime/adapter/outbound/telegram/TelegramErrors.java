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

package me.golemcore.runtime.adapter.outbound.telegram;

import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for reading Bot API error responses.
 */
final class TelegramErrors {

    static final int HTTP_TOO_MANY_REQUESTS = 429;

    private static final Pattern RETRY_AFTER_PATTERN = Pattern.compile("retry after (\\d+)");
    private static final int RETRY_AFTER_DEFAULT_SECONDS = 1;

    private TelegramErrors() {
    }

    /**
     * Platform description of the failure, e.g. {@code "Bad Request: chat not
     * found"}, falling back to the exception message.
     */
    static String describe(TelegramApiRequestException e) {
        String apiResponse = e.getApiResponse();
        if (apiResponse != null && !apiResponse.isBlank()) {
            return apiResponse;
        }
        return e.getMessage();
    }

    static boolean isRateLimited(TelegramApiRequestException e) {
        Integer errorCode = e.getErrorCode();
        return errorCode != null && errorCode == HTTP_TOO_MANY_REQUESTS;
    }

    static int retryAfterSeconds(TelegramApiRequestException e, int capSeconds) {
        if (e.getParameters() != null && e.getParameters().getRetryAfter() != null) {
            return Math.min(e.getParameters().getRetryAfter(), capSeconds);
        }
        String message = e.getMessage();
        if (message != null) {
            Matcher matcher = RETRY_AFTER_PATTERN.matcher(message);
            if (matcher.find()) {
                return Math.min(Integer.parseInt(matcher.group(1)), capSeconds);
            }
        }
        return RETRY_AFTER_DEFAULT_SECONDS;
    }
}
