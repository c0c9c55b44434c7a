package com.worldsentinel.analysis.detect;

import com.worldsentinel.analysis.signal.Detection;
import com.worldsentinel.analysis.signal.SubjectKeys;
import com.worldsentinel.core.model.ConvergenceAlert;
import com.worldsentinel.core.model.CountryScore;
import com.worldsentinel.core.model.Deviation;
import com.worldsentinel.core.model.DeviationLevel;
import com.worldsentinel.core.model.InstabilityLevel;
import com.worldsentinel.core.model.MilitarySurge;
import com.worldsentinel.core.model.Severity;
import com.worldsentinel.core.model.SignalKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Detections from aggregated state: volume spikes against baselines, geographic convergence, country
 * instability jumps, and upstream military surge reports.
 */
public class SituationDetectors {
    static final double CRITICAL_Z = 4.0;
    static final double DEFAULT_SURGE_CONFIDENCE = 0.7;

    private final int ciiSpikeDelta;

    public SituationDetectors(int ciiSpikeDelta) {
        this.ciiSpikeDelta = ciiSpikeDelta;
    }

    public List<Detection> keywordSpikes(List<Deviation> deviations, Instant now) {
        List<Detection> detections = new ArrayList<>();
        for (Deviation deviation : deviations) {
            if (deviation.level() != DeviationLevel.SPIKE || !deviation.hasScore()) {
                continue;
            }
            double z = deviation.zScore();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("metricKey", deviation.metricKey());
            details.put("current", deviation.current());
            details.put("mean", deviation.mean());
            details.put("zScore", z);
            detections.add(new Detection(
                    SignalKind.KEYWORD_SPIKE,
                    SubjectKeys.metric(deviation.metricKey()),
                    String.format(Locale.ROOT, "Volume spike on %s (z=%.1f)", deviation.metricKey(), z),
                    Math.min(0.95, 0.5 + z / 10),
                    z >= CRITICAL_Z ? Severity.CRITICAL : Severity.HIGH,
                    details,
                    now
            ));
        }
        return detections;
    }

    public List<Detection> geoConvergence(List<ConvergenceAlert> alerts, Instant now) {
        List<Detection> detections = new ArrayList<>();
        for (ConvergenceAlert alert : alerts) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("cellKey", alert.cellKey());
            details.put("latitude", alert.latitude());
            details.put("longitude", alert.longitude());
            details.put("kinds", alert.kinds().stream().map(Enum::name).sorted().toList());
            details.put("totalEvents", alert.totalEvents());
            details.put("score", alert.score());
            details.put("countryCodes", alert.countryCodes().stream().sorted().toList());
            Severity severity = switch (alert.level()) {
                case CRITICAL -> Severity.CRITICAL;
                case HIGH -> Severity.HIGH;
                case MEDIUM -> Severity.MEDIUM;
            };
            detections.add(new Detection(
                    SignalKind.GEO_CONVERGENCE,
                    SubjectKeys.cell(alert.cellKey()),
                    String.format(Locale.ROOT, "%d activity types converging near %.1f, %.1f",
                            alert.kinds().size(), alert.latitude(), alert.longitude()),
                    alert.score() / 100.0,
                    severity,
                    details,
                    alert.windowEnd() == null ? now : alert.windowEnd()
            ));
        }
        return detections;
    }

    public List<Detection> ciiSpikes(List<CountryScore> scores, Instant now) {
        List<Detection> detections = new ArrayList<>();
        for (CountryScore score : scores) {
            if (score.previousComposite() == null) {
                continue;
            }
            int delta = score.change();
            if (Math.abs(delta) < ciiSpikeDelta) {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("countryCode", score.countryCode());
            details.put("composite", score.composite());
            details.put("previousComposite", score.previousComposite());
            details.put("change", delta);
            details.put("level", score.level().name());
            detections.add(new Detection(
                    SignalKind.CII_SPIKE,
                    SubjectKeys.country(score.countryCode()),
                    String.format(Locale.ROOT, "%s instability %s %d to %d", score.countryCode(),
                            delta > 0 ? "up" : "down", score.previousComposite(), score.composite()),
                    Math.min(0.95, 0.6 + Math.abs(delta) / 100.0),
                    ciiSeverity(score.level(), Math.abs(delta)),
                    details,
                    score.computedAt() == null ? now : score.computedAt()
            ));
        }
        return detections;
    }

    static Severity ciiSeverity(InstabilityLevel level, int absoluteDelta) {
        if (level == InstabilityLevel.CRITICAL) {
            return Severity.CRITICAL;
        }
        if (level == InstabilityLevel.HIGH || absoluteDelta >= 30) {
            return Severity.HIGH;
        }
        if (level == InstabilityLevel.ELEVATED || absoluteDelta >= 15) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    public List<Detection> militarySurges(List<MilitarySurge> surges, Instant now) {
        List<Detection> detections = new ArrayList<>();
        for (MilitarySurge surge : surges) {
            if (surge.theaterId() == null || surge.theaterId().isBlank()) {
                continue;
            }
            double confidence = surge.confidence() == null ? DEFAULT_SURGE_CONFIDENCE : surge.confidence();
            boolean doubled = surge.baselineCount() > 0
                    ? surge.aircraftCount() >= 2 * surge.baselineCount()
                    : surge.aircraftCount() > 0;
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("theaterId", surge.theaterId());
            details.put("aircraftCount", surge.aircraftCount());
            details.put("baselineCount", surge.baselineCount());
            detections.add(new Detection(
                    SignalKind.MILITARY_SURGE,
                    SubjectKeys.theater(surge.theaterId()),
                    surge.title() == null || surge.title().isBlank()
                            ? "Military activity surge in " + surge.theaterId()
                            : surge.title(),
                    confidence,
                    doubled ? Severity.HIGH : Severity.MEDIUM,
                    details,
                    surge.observedAt() == null ? now : surge.observedAt()
            ));
        }
        return detections;
    }
}
