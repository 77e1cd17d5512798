package com.loadforecast.service;

import com.loadforecast.dto.ModelVersionResponse;
import com.loadforecast.exception.ModelNotFoundException;
import com.loadforecast.model.ModelSpecification;
import com.loadforecast.model.TrainedModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class InMemoryModelRegistry implements ModelRegistry {

    private static final Pattern EXPERIMENT_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]{1,64}$");

    private final Clock clock;
    private final ConcurrentHashMap<String, List<RegisteredModel>> experiments = new ConcurrentHashMap<>();

    @Override
    public RegisteredModel load(String experimentName, String runId) {
        List<RegisteredModel> runs = experiments.get(experimentName);
        if (runs == null) {
            throw new ModelNotFoundException(experimentName, runId);
        }
        synchronized (runs) {
            if (runs.isEmpty()) {
                throw new ModelNotFoundException(experimentName, runId);
            }
            if (runId == null) {
                return runs.get(runs.size() - 1);
            }
            return runs.stream()
                .filter(r -> r.runId().equals(runId))
                .findFirst()
                .orElseThrow(() -> new ModelNotFoundException(experimentName, runId));
        }
    }

    @Override
    public RegisteredModel save(String experimentName, TrainedModel model, ModelSpecification specification) {
        if (experimentName == null || !EXPERIMENT_PATTERN.matcher(experimentName).matches()) {
            throw new IllegalArgumentException("Experiment name must match " + EXPERIMENT_PATTERN.pattern());
        }
        ModelSpecification spec = specification.getId() != null ? specification
            : specification.toBuilder().id(experimentName).build();
        RegisteredModel registered = new RegisteredModel(
            experimentName, UUID.randomUUID().toString(), Instant.now(clock), model, spec);

        List<RegisteredModel> runs = experiments.computeIfAbsent(experimentName, k -> new ArrayList<>());
        synchronized (runs) {
            runs.add(registered);
        }
        log.info("Model registered | experiment={} | runId={} | algtype={}",
                 experimentName, registered.runId(), model.path());
        return registered;
    }

    public ModelVersionResponse describe(String experimentName) {
        RegisteredModel latest = load(experimentName, null);
        TrainedModel model = latest.model();
        return ModelVersionResponse.builder()
            .experimentName(latest.experimentName())
            .runId(latest.runId())
            .registeredAt(latest.registeredAt())
            .algtype(model.path())
            .featureNames(latest.specification().getFeatureNames())
            .hyperparameters(latest.specification().getHyperparameters())
            .featureImportance(Map.copyOf(model.getFeatureImportance()))
            .build();
    }
}
