package com.worldsentinel.analysis.country;

import com.worldsentinel.analysis.entity.EntityRegistry;
import com.worldsentinel.analysis.entity.TextMatcher;
import com.worldsentinel.core.model.ConvergenceAlert;
import com.worldsentinel.core.model.EntityRecord;
import com.worldsentinel.core.model.GeoEvent;
import com.worldsentinel.core.model.MonitoredCountry;
import com.worldsentinel.core.model.NewsCluster;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps clusters and geo events onto monitored countries. Geo events carry their own country code;
 * clusters are attributed when a country entity's name or alias appears in the primary title.
 */
public class CountryAttribution {
    private final Map<String, Set<String>> namesByCode = new LinkedHashMap<>();

    public CountryAttribution(EntityRegistry registry, List<MonitoredCountry> countries) {
        for (MonitoredCountry country : countries) {
            String code = normalize(country.code());
            Set<String> names = new LinkedHashSet<>();
            if (country.name() != null && !country.name().isBlank()) {
                names.add(country.name());
            }
            registry.byId(code).ifPresent(entity -> addNames(names, entity));
            namesByCode.put(code, names);
        }
    }

    public Map<String, CountrySignals> attribute(
            List<NewsCluster> clusters,
            List<GeoEvent> geoEvents,
            List<ConvergenceAlert> convergenceAlerts
    ) {
        Map<String, Counts> counts = new LinkedHashMap<>();
        namesByCode.keySet().forEach(code -> counts.put(code, new Counts()));

        for (GeoEvent event : geoEvents) {
            if (event == null || event.kind() == null || event.countryCode() == null) {
                continue;
            }
            Counts country = counts.get(normalize(event.countryCode()));
            if (country == null) {
                continue;
            }
            switch (event.kind()) {
                case PROTEST -> {
                    country.protests++;
                    country.fatalities += event.fatalitiesOrZero();
                    if (event.highSeverity()) {
                        country.highSeverity++;
                    }
                }
                case MILITARY_FLIGHT -> country.flights++;
                case MILITARY_VESSEL -> country.vessels++;
                case EARTHQUAKE, OUTAGE -> {
                    if (event.highSeverity()) {
                        country.highSeverity++;
                    }
                }
            }
        }

        for (NewsCluster cluster : clusters) {
            for (String code : countriesMentionedIn(cluster.primaryTitle())) {
                Counts country = counts.get(code);
                country.clusters++;
                country.items += cluster.size();
                country.velocitySum += cluster.velocityPerHour();
                country.alert |= cluster.alert();
            }
        }

        for (ConvergenceAlert alert : convergenceAlerts) {
            for (String code : alert.countryCodes()) {
                Counts country = counts.get(normalize(code));
                if (country != null) {
                    country.alert = true;
                }
            }
        }

        Map<String, CountrySignals> result = new LinkedHashMap<>();
        counts.forEach((code, country) -> result.put(code, country.toSignals()));
        return result;
    }

    public List<String> countriesMentionedIn(String title) {
        List<String> codes = new ArrayList<>();
        if (title == null || title.isBlank()) {
            return codes;
        }
        namesByCode.forEach((code, names) -> {
            for (String name : names) {
                if (TextMatcher.containsWord(title, name)) {
                    codes.add(code);
                    return;
                }
            }
        });
        return codes;
    }

    private static void addNames(Set<String> names, EntityRecord entity) {
        if (entity.displayName() != null && !entity.displayName().isBlank()) {
            names.add(entity.displayName());
        }
        for (String alias : entity.aliases()) {
            if (alias.length() >= TextMatcher.MIN_ALIAS_LENGTH) {
                names.add(alias);
            }
        }
    }

    private static String normalize(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }

    private static final class Counts {
        private int protests;
        private int fatalities;
        private int highSeverity;
        private int flights;
        private int vessels;
        private int clusters;
        private int items;
        private double velocitySum;
        private boolean alert;

        private CountrySignals toSignals() {
            double avgVelocity = clusters == 0 ? 0 : velocitySum / clusters;
            return new CountrySignals(protests, fatalities, highSeverity, flights, vessels, clusters, items,
                    avgVelocity, alert);
        }
    }
}
