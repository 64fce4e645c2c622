package me.golemcore.runtime.domain.reducer;

import me.golemcore.runtime.domain.model.Action;
import me.golemcore.runtime.domain.model.ChatId;
import me.golemcore.runtime.domain.model.Event;
import me.golemcore.runtime.domain.model.FoldResult;
import me.golemcore.runtime.domain.model.Identity;
import me.golemcore.runtime.domain.model.MessageEvent;
import me.golemcore.runtime.domain.model.SendMessageAction;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static me.golemcore.runtime.testsupport.TestEvents.text;
import static org.junit.jupiter.api.Assertions.*;

class ReducerInvokerTest {

    /**
     * State is the list of folded update ids; every message is echoed back once
     * per word.
     */
    private static final class EchoReducer implements Reducer<List<Long>> {

        private final List<Long> invocations = new ArrayList<>();

        @Override
        public FoldResult<List<Long>> init(Identity identity) {
            return FoldResult.unchanged(List.of());
        }

        @Override
        public FoldResult<List<Long>> reduce(Event event, List<Long> state) {
            invocations.add(event.updateId());
            List<Long> next = new ArrayList<>(state);
            next.add(event.updateId());
            String messageText = ((MessageEvent) event).message().text();
            if ("boom".equals(messageText)) {
                throw new IllegalStateException("boom");
            }
            if ("null".equals(messageText)) {
                return null;
            }
            List<Action> actions = new ArrayList<>();
            for (String word : messageText.split(" ")) {
                actions.add(SendMessageAction.text(new ChatId(1), word));
            }
            return FoldResult.of(List.copyOf(next), actions);
        }
    }

    @Test
    void fold_threadsStateAndConcatenatesActionsInOrder() {
        EchoReducer reducer = new EchoReducer();
        ReducerInvoker<List<Long>> invoker = new ReducerInvoker<>(reducer);

        FoldResult<List<Long>> result = invoker.fold(List.of(), List.of(text(1, "e1 e2"), text(2, "e3")));

        assertEquals(List.of(1L, 2L), result.state());
        assertEquals(List.of("e1", "e2", "e3"), result.actions().stream()
                .map(action -> ((SendMessageAction) action).text())
                .toList());
        assertEquals(List.of(1L, 2L), reducer.invocations);
    }

    @Test
    void fold_emptyBatchReturnsStateUnchanged() {
        ReducerInvoker<List<Long>> invoker = new ReducerInvoker<>(new EchoReducer());
        List<Long> state = List.of(9L);

        FoldResult<List<Long>> result = invoker.fold(state, List.of());

        assertSame(state, result.state());
        assertTrue(result.actions().isEmpty());
    }

    @Test
    void fold_isDeterministicForSameInput() {
        ReducerInvoker<List<Long>> invoker = new ReducerInvoker<>(new EchoReducer());
        List<Event> batch = List.of(text(10, "a b"), text(11, "c"));

        FoldResult<List<Long>> first = invoker.fold(List.of(3L), batch);
        FoldResult<List<Long>> second = invoker.fold(List.of(3L), batch);

        assertEquals(first, second);
    }

    @Test
    void fold_rejectsEventsOutOfOrder() {
        ReducerInvoker<List<Long>> invoker = new ReducerInvoker<>(new EchoReducer());

        assertThrows(IllegalArgumentException.class,
                () -> invoker.fold(List.of(), List.of(text(5, "a"), text(4, "b"))));
        assertThrows(IllegalArgumentException.class,
                () -> invoker.fold(List.of(), List.of(text(5, "a"), text(5, "b"))));
    }

    @Test
    void fold_skipsEventWhoseReducerCallThrows() {
        EchoReducer reducer = new EchoReducer();
        ReducerInvoker<List<Long>> invoker = new ReducerInvoker<>(reducer);

        FoldResult<List<Long>> result = invoker.fold(List.of(),
                List.of(text(1, "x"), text(2, "boom"), text(3, "y")));

        assertEquals(List.of(1L, 3L), result.state());
        assertEquals(2, result.actions().size());
        assertEquals(List.of(1L, 2L, 3L), reducer.invocations);
    }

    @Test
    void fold_skipsEventWhenReducerReturnsNull() {
        ReducerInvoker<List<Long>> invoker = new ReducerInvoker<>(new EchoReducer());

        FoldResult<List<Long>> result = invoker.fold(List.of(), List.of(text(1, "null"), text(2, "z")));

        assertEquals(List.of(2L), result.state());
        assertEquals(1, result.actions().size());
    }
}
