package com.healthiq.analytics.alert;

import com.healthiq.model.analytics.UserAlert;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryAlertStore implements AlertStore {

    private static final Logger LOG = Logger.getLogger(InMemoryAlertStore.class);

    private final Map<String, List<UserAlert>> byIdentity = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Duration dedupWindow;

    public InMemoryAlertStore(Duration dedupWindow) {
        this.dedupWindow = dedupWindow;
    }

    private List<UserAlert> bucket(String identity) {
        return byIdentity.computeIfAbsent(identity, i -> Collections.synchronizedList(new ArrayList<>()));
    }

    // reads never create a bucket
    private List<UserAlert> existing(String identity) {
        return byIdentity.getOrDefault(identity, List.of());
    }

    @Override
    public Optional<UserAlert> save(String identity, UserAlert alert) {
        List<UserAlert> list = bucket(identity);
        synchronized (list) {
            Instant since = alert.getTriggeredAt().minus(dedupWindow);
            for (UserAlert existing : list) {
                if (existing.isActive()
                        && existing.getRuleType() == alert.getRuleType()
                        && !existing.getTriggeredAt().isBefore(since)) {
                    LOG.infof("Suppressed %s alert for %s: %s is still active", alert.getRuleType().value(), identity, existing.getId());
                    return Optional.empty();
                }
            }
            UserAlert saved = alert.toBuilder()
                    .id("alert-" + sequence.incrementAndGet())
                    .identity(identity)
                    .build();
            list.add(saved);
            LOG.infof("Persisted %s alert %s for %s", saved.getRuleType().value(), saved.getId(), identity);
            return Optional.of(saved);
        }
    }

    @Override
    public boolean acknowledge(String identity, String alertId, Instant at) {
        List<UserAlert> list = existing(identity);
        synchronized (list) {
            for (int i = 0; i < list.size(); i++) {
                UserAlert alert = list.get(i);
                if (alert.getId().equals(alertId)) {
                    if (alert.isAcknowledged()) {
                        return false;
                    }
                    list.set(i, alert.acknowledge(at));
                    LOG.infof("Acknowledged alert %s for %s", alertId, identity);
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public Optional<UserAlert> findById(String identity, String alertId) {
        List<UserAlert> list = existing(identity);
        synchronized (list) {
            return list.stream().filter(a -> a.getId().equals(alertId)).findFirst();
        }
    }

    @Override
    public List<UserAlert> findActive(String identity) {
        List<UserAlert> list = existing(identity);
        synchronized (list) {
            return list.stream().filter(UserAlert::isActive).toList();
        }
    }

    @Override
    public List<UserAlert> findAll(String identity) {
        List<UserAlert> list = existing(identity);
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    int identityCount() {
        return byIdentity.size();
    }
}
