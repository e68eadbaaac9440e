package com.healthiq.analytics.hsi;

import com.healthiq.model.analytics.HsiScore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryScoreHistoryStore implements ScoreHistoryStore {

    private final Map<String, List<HsiScore>> byIdentity = new ConcurrentHashMap<>();

    private List<HsiScore> bucket(String identity) {
        return byIdentity.computeIfAbsent(identity, i -> Collections.synchronizedList(new ArrayList<>()));
    }

    private List<HsiScore> existing(String identity) {
        return byIdentity.getOrDefault(identity, List.of());
    }

    @Override
    public void append(String identity, HsiScore score) {
        bucket(identity).add(Objects.requireNonNull(score, "score"));
    }

    @Override
    public Optional<HsiScore> latest(String identity) {
        List<HsiScore> list = existing(identity);
        synchronized (list) {
            return list.isEmpty() ? Optional.empty() : Optional.of(list.get(list.size() - 1));
        }
    }

    @Override
    public List<HsiScore> history(String identity) {
        List<HsiScore> list = existing(identity);
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    int identityCount() {
        return byIdentity.size();
    }
}
