package com.medimind.alert.core.event;

/** Handle returned by {@link AlertEventBus#subscribe}; closing it detaches the listener. */
public interface Subscription extends AutoCloseable {
    @Override
    void close();

    boolean isActive();
}
