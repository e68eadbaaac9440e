package com.healthiq.analytics.alert;

import com.healthiq.model.analytics.UserAlert;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of alerts per identity. Saving assigns {@code id} and {@code identity} and enforces
 * deduplication: an alert is suppressed when an un-acknowledged alert of the same rule type was
 * triggered for the same identity within the dedup window before it.
 */
public interface AlertStore {

    /**
     * @return the persisted alert, or empty when it was suppressed as a duplicate
     */
    Optional<UserAlert> save(String identity, UserAlert alert);

    default List<UserAlert> saveAll(String identity, List<UserAlert> alerts) {
        List<UserAlert> saved = new ArrayList<>();
        for (UserAlert alert : alerts) {
            save(identity, alert).ifPresent(saved::add);
        }
        return saved;
    }

    /**
     * Marks the alert acknowledged. Acknowledgement is terminal.
     *
     * @return true if the alert existed and was active; false for an unknown or already acknowledged id
     */
    boolean acknowledge(String identity, String alertId, Instant at);

    Optional<UserAlert> findById(String identity, String alertId);

    /**
     * @return un-acknowledged alerts, oldest first
     */
    List<UserAlert> findActive(String identity);

    /**
     * @return every alert, oldest first
     */
    List<UserAlert> findAll(String identity);
}
