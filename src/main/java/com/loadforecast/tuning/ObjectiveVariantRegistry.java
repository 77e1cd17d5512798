package com.loadforecast.tuning;

import com.loadforecast.model.ModelFamily;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ObjectiveVariantRegistry {

    private final Map<ModelFamily, ObjectiveVariant> variants = new EnumMap<>(ModelFamily.class);

    public ObjectiveVariantRegistry(List<ObjectiveVariant> variants) {
        for (ObjectiveVariant variant : variants) {
            ObjectiveVariant previous = this.variants.putIfAbsent(variant.family(), variant);
            if (previous != null) {
                throw new IllegalStateException("Duplicate objective variant for " + variant.family() + ": "
                    + previous.getClass().getSimpleName() + ", " + variant.getClass().getSimpleName());
            }
        }
    }

    public ObjectiveVariant forFamily(ModelFamily family) {
        ObjectiveVariant variant = variants.get(family);
        if (variant == null) {
            throw new IllegalArgumentException("No objective variant registered for " + family);
        }
        return variant;
    }
}
