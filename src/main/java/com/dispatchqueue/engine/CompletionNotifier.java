package com.dispatchqueue.engine;

/**
 * Side channel for "your job finished" messages, used when a payload asks for one.
 * Implementations must not throw back into the engine; the engine logs anything they do throw.
 */
public interface CompletionNotifier {

    enum Outcome {
        SUCCESS,
        FAILURE
    }

    CompletionNotifier NONE = (summary, outcome) -> { };

    void emit(String summary, Outcome outcome);
}
