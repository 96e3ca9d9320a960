package com.unhuman.nordnetportfolio.core;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * {@link AuthProgressListener} that queues events for another thread to consume, so the
 * login worker never touches user-interface state directly. Input prompts are answered by the
 * consumer through {@link ProgressEvent#reply(String)}.
 */
public class ProgressChannel implements AuthProgressListener {

    public enum EventType { STATE, STATUS, INPUT_REQUEST }

    private final BlockingQueue<ProgressEvent> queue = new LinkedBlockingQueue<>();

    @Override
    public void onStateChanged(AuthFlowState state, String message) {
        queue.add(new ProgressEvent(EventType.STATE, state, message, null));
    }

    @Override
    public void onStatus(String message) {
        queue.add(new ProgressEvent(EventType.STATUS, null, message, null));
    }

    @Override
    public String requestInput(String prompt) throws InterruptedException {
        CompletableFuture<String> answer = new CompletableFuture<>();
        queue.add(new ProgressEvent(EventType.INPUT_REQUEST, null, prompt, answer));
        try {
            return answer.get();
        } catch (ExecutionException e) {
            return null;
        }
    }

    /** Next event, waiting up to the given time; null if none arrived. */
    public ProgressEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public ProgressEvent take() throws InterruptedException {
        return queue.take();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public static final class ProgressEvent {
        private final EventType type;
        private final AuthFlowState state;
        private final String message;
        private final CompletableFuture<String> answer;

        ProgressEvent(EventType type, AuthFlowState state, String message, CompletableFuture<String> answer) {
            this.type = type;
            this.state = state;
            this.message = message;
            this.answer = answer;
        }

        public EventType getType() { return type; }
        public AuthFlowState getState() { return state; }
        public String getMessage() { return message; }

        /** Answer an {@link EventType#INPUT_REQUEST}; ignored for other events. */
        public void reply(String value) {
            if (answer != null) {
                answer.complete(value);
            }
        }

        @Override
        public String toString() {
            return "ProgressEvent{" + type + (state != null ? ", " + state : "") + ", " + message + "}";
        }
    }
}
