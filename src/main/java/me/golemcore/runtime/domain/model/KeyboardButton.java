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

import java.util.Objects;

/**
 * One button of an {@link InlineKeyboard}. Exactly one of {@code callbackData}
 * and {@code url} is set.
 */
public record KeyboardButton(String text, String callbackData, String url) {

    public KeyboardButton {
        Objects.requireNonNull(text, "text");
        if ((callbackData == null) == (url == null)) {
            throw new IllegalArgumentException("Button must have either callback data or url: " + text);
        }
    }

    public static KeyboardButton callback(String text, String callbackData) {
        return new KeyboardButton(text, callbackData, null);
    }

    public static KeyboardButton link(String text, String url) {
        return new KeyboardButton(text, null, url);
    }
}
