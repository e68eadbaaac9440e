package com.healthiq.analytics.hsi;

import com.healthiq.model.analytics.HsiScore;

import java.util.List;
import java.util.Optional;

/**
 * Append-only history of computed scores per identity.
 */
public interface ScoreHistoryStore {

    void append(String identity, HsiScore score);

    Optional<HsiScore> latest(String identity);

    /**
     * @return scores oldest first
     */
    List<HsiScore> history(String identity);
}
