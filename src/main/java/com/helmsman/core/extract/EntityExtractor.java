package com.helmsman.core.extract;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based extraction of structured spans from document text.
 * <p>
 * Every result contains all {@link #KINDS}, each deduplicated in first-seen
 * order. {@code locations} and {@code personnel} have no extraction rule yet
 * and are always empty.
 */
@Component
public class EntityExtractor {

    public static final String EQUIPMENT = "equipment";
    public static final String LOCATIONS = "locations";
    public static final String DATES = "dates";
    public static final String MEASUREMENTS = "measurements";
    public static final String PERSONNEL = "personnel";

    public static final List<String> KINDS = List.of(EQUIPMENT, LOCATIONS, DATES, MEASUREMENTS, PERSONNEL);

    private static final Pattern EQUIPMENT_PATTERN = Pattern.compile(
            "\\b(engine|motor|pump|valve|turbine|generator|propeller"
                    + "|radar|gps|compass|navigation|steering"
                    + "|hull|deck|bridge|compartment)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DATE_PATTERN = Pattern.compile(
            "\\b\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}\\b");

    private static final Pattern MEASUREMENT_PATTERN = Pattern.compile(
            "\\b\\d+(?:\\.\\d+)?\\s*(?:meters?|feet|inches|kg|lbs|degrees?|psi|bar)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SPACES = Pattern.compile("\\s+");

    /**
     * @return mapping of entity kind to matched spans, with every kind present
     */
    public Map<String, Set<String>> extract(String text) {
        var entities = new LinkedHashMap<String, Set<String>>();
        for (String kind : KINDS) {
            entities.put(kind, new LinkedHashSet<>());
        }
        if (text == null || text.isBlank()) {
            return entities;
        }

        collect(EQUIPMENT_PATTERN, text, entities.get(EQUIPMENT), m -> m.group(1).toLowerCase(Locale.ROOT));
        collect(DATE_PATTERN, text, entities.get(DATES), Matcher::group);
        collect(MEASUREMENT_PATTERN, text, entities.get(MEASUREMENTS),
                m -> SPACES.matcher(m.group()).replaceAll(" "));
        return entities;
    }

    private static void collect(Pattern pattern, String text, Set<String> target,
                                Function<Matcher, String> extractor) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            target.add(extractor.apply(matcher));
        }
    }
}
