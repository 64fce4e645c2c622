package me.golemcore.runtime.domain.reducer;

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

import me.golemcore.runtime.domain.model.CallbackQuery;
import me.golemcore.runtime.domain.model.CallbackQueryEvent;
import me.golemcore.runtime.domain.model.Event;
import me.golemcore.runtime.domain.model.FoldResult;
import me.golemcore.runtime.domain.model.IncomingMessage;
import me.golemcore.runtime.domain.model.InlineQuery;
import me.golemcore.runtime.domain.model.InlineQueryEvent;
import me.golemcore.runtime.domain.model.MessageEvent;

/**
 * Reducer base that routes each event variant to its own handler. Handlers that
 * are not overridden leave the state unchanged and emit nothing.
 */
public abstract class RoutingReducer<S> implements Reducer<S> {

    @Override
    public final FoldResult<S> reduce(Event event, S state) {
        if (event instanceof MessageEvent messageEvent) {
            return onMessage(messageEvent.message(), state);
        }
        if (event instanceof InlineQueryEvent inlineQueryEvent) {
            return onInlineQuery(inlineQueryEvent.query(), state);
        }
        if (event instanceof CallbackQueryEvent callbackQueryEvent) {
            return onCallbackQuery(callbackQueryEvent.query(), state);
        }
        throw new IllegalStateException("Unknown event type: " + event.getClass().getName());
    }

    protected FoldResult<S> onMessage(IncomingMessage message, S state) {
        return FoldResult.unchanged(state);
    }

    protected FoldResult<S> onInlineQuery(InlineQuery query, S state) {
        return FoldResult.unchanged(state);
    }

    protected FoldResult<S> onCallbackQuery(CallbackQuery query, S state) {
        return FoldResult.unchanged(state);
    }
}
