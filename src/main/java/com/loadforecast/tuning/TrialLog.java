package com.loadforecast.tuning;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only record of evaluated trials, owned by whoever drives the search. Safe for
 * concurrent writers; each trial number can be written exactly once.
 */
public class TrialLog {

    private final ConcurrentHashMap<Integer, Trial> trials = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException when a trial with the same number was already recorded
     */
    public void append(Trial trial) {
        Trial existing = trials.putIfAbsent(trial.number(), trial);
        if (existing != null) {
            throw new IllegalStateException("Trial " + trial.number() + " is already recorded");
        }
    }

    public Optional<Trial> get(int number) {
        return Optional.ofNullable(trials.get(number));
    }

    public List<Trial> trials() {
        return trials.values().stream()
            .sorted(Comparator.comparingInt(Trial::number))
            .toList();
    }

    public Optional<Trial> best() {
        return trials.values().stream()
            .filter(t -> !Double.isNaN(t.score()))
            .min(Comparator.comparingDouble(Trial::score).thenComparingInt(Trial::number));
    }

    public int size() {
        return trials.size();
    }

    /** JSON friendly view: {@code "trial: n" -> {score, params}}. */
    public Map<String, Map<String, Object>> summary() {
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        for (Trial trial : trials()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("score", trial.score());
            entry.put("params", trial.params());
            out.put("trial: " + trial.number(), entry);
        }
        return out;
    }
}
