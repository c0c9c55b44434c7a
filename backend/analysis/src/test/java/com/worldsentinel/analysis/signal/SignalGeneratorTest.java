package com.worldsentinel.analysis.signal;

import com.worldsentinel.core.model.Severity;
import com.worldsentinel.core.model.Signal;
import com.worldsentinel.core.model.SignalKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.worldsentinel.analysis.support.TestData.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalGeneratorTest {
    private final SignalGenerator generator = new SignalGenerator(0.6);

    @Test
    void repeatInsideTtlIsSuppressedEvenWithDifferentMagnitude() {
        DedupTable dedup = new DedupTable();
        Detection first = detection(SignalKind.SILENT_DIVERGENCE, "AVGO", 0.8, Severity.MEDIUM, Map.of("move", 3.1));
        Detection repeat = detection(SignalKind.SILENT_DIVERGENCE, "AVGO", 0.8, Severity.MEDIUM, Map.of("move", 4.7));

        assertEquals(1, generator.generate(List.of(first), dedup, NOW).size());
        assertTrue(generator.generate(List.of(repeat), dedup, NOW.plus(Duration.ofHours(1))).isEmpty());
        assertEquals(1, generator.generate(List.of(repeat), dedup, NOW.plus(Duration.ofHours(6))).size());
    }

    @Test
    void sameCycleDuplicatesKeepTheMostConfident() {
        List<Signal> signals = generator.generate(List.of(
                detection(SignalKind.VELOCITY_SPIKE, "cluster-1", 0.7, Severity.MEDIUM, Map.of()),
                detection(SignalKind.VELOCITY_SPIKE, "cluster-1", 0.9, Severity.HIGH, Map.of())
        ), new DedupTable(), NOW);

        assertEquals(1, signals.size());
        assertEquals(0.9, signals.get(0).confidence(), 1e-9);
    }

    @Test
    void lowConfidenceIsDroppedWithoutConsumingDedupSlot() {
        DedupTable dedup = new DedupTable();

        assertTrue(generator.generate(List.of(
                detection(SignalKind.TRIANGULATION, "cluster-1", 0.5, Severity.HIGH, Map.of())), dedup, NOW).isEmpty());
        assertEquals(0, dedup.size());
        assertEquals(1, generator.generate(List.of(
                detection(SignalKind.TRIANGULATION, "cluster-1", 0.6, Severity.HIGH, Map.of())), dedup, NOW).size());
    }

    @Test
    void learningWithholdsCountryIndexSignalsOnly() {
        DedupTable dedup = new DedupTable();
        List<Signal> signals = generator.generate(List.of(
                detection(SignalKind.CII_SPIKE, "UA", 0.9, Severity.HIGH, Map.of()),
                detection(SignalKind.GEO_CONVERGENCE, "cell:25,121", 0.9, Severity.CRITICAL, Map.of())
        ), dedup, NOW, true);

        assertEquals(List.of(SignalKind.GEO_CONVERGENCE), signals.stream().map(Signal::kind).toList());
        assertEquals(1, generator.generate(List.of(
                detection(SignalKind.CII_SPIKE, "UA", 0.9, Severity.HIGH, Map.of())), dedup, NOW, false).size());
    }

    @Test
    void ordersBySeverityConfidenceThenRecency() {
        List<Signal> signals = generator.generate(List.of(
                detection(SignalKind.KEYWORD_SPIKE, "news:all", 0.7, Severity.MEDIUM, Map.of()),
                detection(SignalKind.GEO_CONVERGENCE, "cell:1,1", 0.8, Severity.CRITICAL, Map.of()),
                new Detection(SignalKind.VELOCITY_SPIKE, "cluster-old", "old", 0.9, Severity.HIGH, Map.of(),
                        NOW.minusSeconds(600)),
                new Detection(SignalKind.VELOCITY_SPIKE, "cluster-new", "new", 0.9, Severity.HIGH, Map.of(),
                        NOW.minusSeconds(60)),
                detection(SignalKind.SOURCE_CONVERGENCE, "cluster-x", 0.95, Severity.HIGH, Map.of())
        ), new DedupTable(), NOW);

        assertEquals(List.of("cell:1,1", "cluster-x", "cluster-new", "cluster-old", "news:all"),
                signals.stream().map(Signal::subjectKey).toList());
    }

    @Test
    void signalCarriesDetectionFields() {
        Signal signal = generator.generate(List.of(new Detection(SignalKind.FLOW_DROP, "cluster-9",
                "Druzhba pipeline flows halted", 0.75, Severity.HIGH, Map.of("headline", "x"), null)),
                new DedupTable(), NOW).get(0);

        assertEquals(NOW, signal.firstFiredAt());
        assertEquals("x", signal.details().get("headline"));
        assertTrue(signal.id().startsWith("sig-"));
        assertEquals("Druzhba pipeline flows halted", signal.title());
    }

    @Test
    void detectionClampsConfidence() {
        assertEquals(1.0, detection(SignalKind.FLOW_DROP, "s", 1.7, Severity.LOW, null).confidence());
        assertEquals(0.0, detection(SignalKind.FLOW_DROP, "s", Double.NaN, Severity.LOW, null).confidence());
    }

    private static Detection detection(SignalKind kind, String subject, double confidence, Severity severity,
                                       Map<String, Object> details) {
        return new Detection(kind, subject, kind + " " + subject, confidence, severity, details, NOW);
    }
}
