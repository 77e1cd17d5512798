package com.loadforecast.features;

import com.loadforecast.features.HolidayReferenceLoader.Holiday;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Calendar features built once from the national and school holiday reference files.
 * <ul>
 *   <li>{@code is_national_holiday}: any national holiday</li>
 *   <li>{@code is_<holiday>}: one per named national holiday</li>
 *   <li>{@code is_bridgeday}: any bridge day</li>
 *   <li>{@code is_bridgeday<holiday>}: bridge days next to that holiday</li>
 *   <li>{@code is_schoolholiday}: any school holiday in any region</li>
 *   <li>{@code is_<label>}: one per school holiday region label</li>
 * </ul>
 */
@Slf4j
@Component
public class HolidayFeatureFunctions implements FeatureFunctionProvider {

    public static final String NATIONAL_HOLIDAY = "is_national_holiday";
    public static final String BRIDGE_DAY = "is_bridgeday";
    public static final String SCHOOL_HOLIDAY = "is_schoolholiday";

    private final Map<String, FeatureFunction> functions;

    @Autowired
    public HolidayFeatureFunctions(HolidayReferenceLoader loader,
                                   @Value("${forecast.holidays.national-csv:classpath:holidays/national_holidays.csv}") Resource nationalCsv,
                                   @Value("${forecast.holidays.school-csv:classpath:holidays/school_holidays.csv}") Resource schoolCsv) {
        this(loader.load(nationalCsv), loader.load(schoolCsv));
    }

    public HolidayFeatureFunctions(List<Holiday> nationalHolidays, List<Holiday> schoolHolidays) {
        Map<String, FeatureFunction> built = new LinkedHashMap<>();

        Map<String, Set<LocalDate>> byName = groupByName(nationalHolidays);
        Set<LocalDate> allNational = nationalHolidays.stream().map(Holiday::date).collect(Collectors.toCollection(TreeSet::new));
        built.put(NATIONAL_HOLIDAY, new DateSetFeature(NATIONAL_HOLIDAY, allNational));
        byName.forEach((name, dates) -> addLabelFeature(built, featureName(name), dates, name));

        BridgeDayDetector detector = new BridgeDayDetector(allNational);
        Set<LocalDate> allBridgeDays = new TreeSet<>();
        Map<String, Set<LocalDate>> bridgeDaysByName = new TreeMap<>();
        byName.forEach((name, dates) -> {
            Set<LocalDate> bridgeDays = new TreeSet<>();
            dates.forEach(d -> bridgeDays.addAll(detector.bridgeDaysAround(d)));
            if (!bridgeDays.isEmpty()) {
                bridgeDaysByName.put(name, bridgeDays);
                allBridgeDays.addAll(bridgeDays);
            }
        });
        built.put(BRIDGE_DAY, new DateSetFeature(BRIDGE_DAY, allBridgeDays));
        bridgeDaysByName.forEach((name, dates) -> {
            String feature = BRIDGE_DAY + normalise(name);
            built.put(feature, new DateSetFeature(feature, dates));
        });

        Set<LocalDate> allSchool = schoolHolidays.stream().map(Holiday::date).collect(Collectors.toCollection(TreeSet::new));
        built.put(SCHOOL_HOLIDAY, new DateSetFeature(SCHOOL_HOLIDAY, allSchool));
        groupByName(schoolHolidays).forEach((label, dates) -> addLabelFeature(built, featureName(label), dates, label));

        this.functions = Collections.unmodifiableMap(built);
        log.info("Holiday features ready | features={} | nationalHolidays={} | bridgeDays={} | schoolHolidayDays={}",
            functions.size(), allNational.size(), allBridgeDays.size(), allSchool.size());
    }

    @Override
    public Map<String, FeatureFunction> featureFunctions() {
        return functions;
    }

    /** First label wins; a later label mapping to a taken feature name only counts in the aggregates. */
    private static void addLabelFeature(Map<String, FeatureFunction> built, String feature, Set<LocalDate> dates,
                                        String label) {
        if (built.containsKey(feature)) {
            log.warn("Holiday label skipped, feature name already taken | label={} | feature={}", label, feature);
            return;
        }
        built.put(feature, new DateSetFeature(feature, dates));
    }

    static String featureName(String holidayName) {
        return "is_" + normalise(holidayName);
    }

    private static String normalise(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
    }

    private static Map<String, Set<LocalDate>> groupByName(List<Holiday> holidays) {
        Map<String, Set<LocalDate>> grouped = new TreeMap<>();
        for (Holiday h : holidays) {
            grouped.computeIfAbsent(h.name(), k -> new TreeSet<>()).add(h.date());
        }
        return grouped;
    }
}
