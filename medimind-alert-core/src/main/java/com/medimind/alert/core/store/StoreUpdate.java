package com.medimind.alert.core.store;

import com.medimind.alert.core.model.Alert;

/**
 * Result of a lifecycle call on the store.
 *
 * @param changed false when the alert was already in the requested state
 */
public record StoreUpdate(Alert alert, boolean changed) {}
