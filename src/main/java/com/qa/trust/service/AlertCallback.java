package com.qa.trust.service;

import com.qa.trust.model.Alert;

/**
 * Receives threshold-crossing alerts. Invoked synchronously on the detecting thread, after
 * the project's counters were reset. Spring beans of this type are registered automatically.
 */
@FunctionalInterface
public interface AlertCallback {

    void onAlert(Alert alert);

    /**
     * Identity used when logging a failed delivery.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
