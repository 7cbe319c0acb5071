package com.buildhook.dispatcher.dispatch;

import com.buildhook.dispatcher.model.InboxMessage;
import com.buildhook.dispatcher.model.Subscription;

/**
 * Notified after a message has been handled and acknowledged.
 * Tests register one to wait for asynchronous handling to finish.
 */
public interface DispatchListener {

    default void onHandled(Subscription subscription, InboxMessage message) {}

    default void onRejected(Subscription subscription, InboxMessage message, Throwable error) {}
}
