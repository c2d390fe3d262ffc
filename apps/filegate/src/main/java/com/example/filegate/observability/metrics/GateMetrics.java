package com.example.filegate.observability.metrics;

import com.example.filegate.security.filter.GateDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Counts gate decisions. Tag values are bounded by {@link GateDecision}.
 */
@Component
public class GateMetrics {

    public static final String DECISION_METRIC = "filegate.decision";

    private final Map<GateDecision, Counter> decisionCounters = new EnumMap<>(GateDecision.class);

    public GateMetrics(@NonNull MeterRegistry registry) {
        for (GateDecision decision : GateDecision.values()) {
            decisionCounters.put(decision, Counter.builder(DECISION_METRIC)
                    .tag("decision", decision.name().toLowerCase(Locale.ROOT))
                    .description("Access gate decisions for protected file requests")
                    .register(registry));
        }
    }

    public void recordDecision(@NonNull GateDecision decision) {
        decisionCounters.get(decision).increment();
    }
}
