package com.zzf.simon.client.stream;

import com.zzf.simon.client.SimonApiException;

/**
 * Callbacks for one chat turn, invoked on the turn's worker thread in envelope order.
 */
public interface ChatListener {

    default void onOpen(StreamEvent.StreamOpen open) {
    }

    /**
     * @param textSoFar all deltas of this turn concatenated, including this one
     */
    default void onDelta(StreamEvent.MessageDelta delta, String textSoFar) {
    }

    default void onFinal(StreamEvent.MessageFinal message) {
    }

    /** Plan, next-action and weekly review cards. */
    default void onCard(StreamEvent card) {
    }

    default void onToolRequest(StreamEvent.ToolRequest request) {
    }

    default void onToolStatus(StreamEvent.ToolStatus status) {
    }

    default void onNotice(StreamEvent.PolicyNotice notice) {
    }

    default void onError(StreamEvent.StreamError error) {
    }

    /** The connection failed; no terminal envelope will follow. */
    default void onFailure(SimonApiException failure) {
    }
}
