package com.medimind.alert.core.event;

@FunctionalInterface
public interface AlertEventListener {
    void onEvent(AlertEvent event) throws Exception;
}
