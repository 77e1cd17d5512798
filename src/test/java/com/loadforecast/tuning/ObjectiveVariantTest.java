package com.loadforecast.tuning;

import com.loadforecast.model.EvalMetric;
import com.loadforecast.model.ModelFamily;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ObjectiveVariantTest {

    private final ObjectiveVariantRegistry registry = new ObjectiveVariantRegistry(List.of(
        new XgbObjectiveVariant(), new XgbQuantileObjectiveVariant(), new XgbMultiOutputQuantileObjectiveVariant(),
        new LgbObjectiveVariant(), new LinearObjectiveVariant(), new ArimaObjectiveVariant()));

    @ParameterizedTest
    @EnumSource(ModelFamily.class)
    void defaultValues_areSubsetOfSearchableParams(ModelFamily family) {
        ObjectiveVariant variant = registry.forFamily(family);
        assertThat(variant.searchableParams()).containsAll(variant.defaultValues().keySet());
    }

    @ParameterizedTest
    @EnumSource(ModelFamily.class)
    void parameterSpace_allAccepted_producesSearchableParams(ModelFamily family) {
        ObjectiveVariant variant = registry.forFamily(family);
        Map<String, Object> params = variant.parameterSpace(new FakeTrialContext(0), variant.searchableParams());
        assertThat(params.keySet()).containsExactlyInAnyOrderElementsOf(variant.searchableParams());
    }

    @Test
    void parameterSpace_commonParamsAreFilteredByModel() {
        ObjectiveVariant xgb = registry.forFamily(ModelFamily.XGB);
        Map<String, Object> params = xgb.parameterSpace(new FakeTrialContext(0), Set.of("max_depth"));
        assertThat(params).containsOnlyKeys("max_depth", "gamma", "booster");
        assertThat(params.get("max_depth")).isEqualTo(3);
    }

    @Test
    void hooks_perFamily() {
        FakeTrialContext trial = new FakeTrialContext(0);
        assertThat(registry.forFamily(ModelFamily.XGB).earlyStoppingHook(EvalMetric.MAE)).isPresent();
        assertThat(registry.forFamily(ModelFamily.LGB).earlyStoppingHook(EvalMetric.MAE)).isPresent();
        assertThat(registry.forFamily(ModelFamily.XGB_QUANTILE).earlyStoppingHook(EvalMetric.MAE)).isEmpty();
        assertThat(registry.forFamily(ModelFamily.XGB_MULTIOUTPUT_QUANTILE).earlyStoppingHook(EvalMetric.MAE)).isEmpty();
        assertThat(registry.forFamily(ModelFamily.XGB_MULTIOUTPUT_QUANTILE).pruningHook(trial, EvalMetric.MAE)).isPresent();
        assertThat(registry.forFamily(ModelFamily.LINEAR).pruningHook(trial, EvalMetric.MAE)).isEmpty();
        assertThat(registry.forFamily(ModelFamily.ARIMA).pruningHook(trial, EvalMetric.MAE)).isEmpty();
    }

    @Test
    void lgb_remapsOnlyMae() {
        ObjectiveVariant lgb = registry.forFamily(ModelFamily.LGB);
        assertThat(lgb.metricName(EvalMetric.MAE)).isEqualTo("l1");
        assertThat(lgb.metricName(EvalMetric.RMSE)).isEqualTo("rmse");
        assertThat(lgb.evalSetName(1)).isEqualTo("valid_1");
    }

    @Test
    void registry_duplicateFamily_isRejected() {
        assertThatThrownBy(() -> new ObjectiveVariantRegistry(List.of(new XgbObjectiveVariant(), new XgbObjectiveVariant())))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void registry_missingFamily_isRejected() {
        ObjectiveVariantRegistry partial = new ObjectiveVariantRegistry(List.of(new LinearObjectiveVariant()));
        assertThatThrownBy(() -> partial.forFamily(ModelFamily.ARIMA))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
