package com.worldsentinel.analysis.signal;

import com.worldsentinel.core.model.Signal;
import com.worldsentinel.core.util.HashingUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Turns detections into signals: drops low-confidence detections, suppresses repeats still inside
 * their kind's TTL, and orders the survivors by severity, confidence, then recency.
 */
public class SignalGenerator {
    private static final Logger LOGGER = Logger.getLogger(SignalGenerator.class.getName());

    static final Comparator<Detection> DETECTION_ORDER = Comparator
            .comparing(Detection::kind)
            .thenComparing(Detection::subjectKey)
            .thenComparing(Detection::confidence, Comparator.reverseOrder());

    static final Comparator<Signal> SIGNAL_ORDER = Comparator
            .comparing(Signal::severity, Comparator.reverseOrder())
            .thenComparing(Signal::confidence, Comparator.reverseOrder())
            .thenComparing(Signal::firstFiredAt, Comparator.reverseOrder())
            .thenComparing(Signal::kind)
            .thenComparing(Signal::subjectKey);

    private final double minConfidence;

    public SignalGenerator(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public List<Signal> generate(List<Detection> detections, DedupTable dedup, Instant now) {
        return generate(detections, dedup, now, false);
    }

    /**
     * Records every emitted signal in {@code dedup}; pass a copy when the outcome may be discarded.
     * While {@code learning}, kinds that reference the country index are withheld.
     */
    public List<Signal> generate(List<Detection> detections, DedupTable dedup, Instant now, boolean learning) {
        List<Detection> ordered = new ArrayList<>(detections);
        ordered.sort(DETECTION_ORDER);

        List<Signal> signals = new ArrayList<>();
        int suppressed = 0;
        for (Detection detection : ordered) {
            if (detection.confidence() < minConfidence) {
                continue;
            }
            if (learning && detection.kind().referencesCountryIndex()) {
                continue;
            }
            if (dedup.isSuppressed(detection.kind(), detection.subjectKey(), now)) {
                suppressed++;
                continue;
            }
            dedup.record(detection.kind(), detection.subjectKey(), now);
            Instant firedAt = detection.observedAt() == null ? now : detection.observedAt();
            signals.add(new Signal(
                    HashingUtils.shortId("sig", detection.kind().name(), detection.subjectKey(), now.toString()),
                    detection.kind(),
                    detection.subjectKey(),
                    detection.title(),
                    detection.confidence(),
                    detection.severity(),
                    firedAt,
                    detection.details()
            ));
        }
        signals.sort(SIGNAL_ORDER);
        if (suppressed > 0) {
            int count = suppressed;
            LOGGER.fine(() -> "Suppressed " + count + " duplicate detections");
        }
        return signals;
    }
}
