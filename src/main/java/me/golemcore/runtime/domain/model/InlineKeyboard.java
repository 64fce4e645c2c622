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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Inline keyboard attached to an outgoing message, as rows of buttons.
 */
public record InlineKeyboard(List<List<KeyboardButton>> rows) {

    public InlineKeyboard {
        List<List<KeyboardButton>> copy = new ArrayList<>();
        for (List<KeyboardButton> row : rows) {
            copy.add(List.copyOf(row));
        }
        rows = List.copyOf(copy);
    }

    public static InlineKeyboard singleRow(KeyboardButton... buttons) {
        return new InlineKeyboard(List.of(Arrays.asList(buttons)));
    }

    public static InlineKeyboard column(KeyboardButton... buttons) {
        List<List<KeyboardButton>> rows = new ArrayList<>();
        for (KeyboardButton button : buttons) {
            rows.add(List.of(button));
        }
        return new InlineKeyboard(rows);
    }
}
