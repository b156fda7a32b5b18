package com.contextkit.core.environment;

import com.contextkit.core.source.EnvironmentProbe;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds the environment fragment of the dynamic layer: the local time plus one
 * line per probe. Weather and system status are always listed; without a
 * reading they show a pending marker.
 */
@Slf4j
public class EnvironmentContextProvider {

    public static final String WEATHER = "Weather";
    public static final String SYSTEM_STATUS = "System status";
    public static final String PENDING = "[pending]";

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm EEEE", Locale.ENGLISH);
    private static final List<String> STANDARD_LABELS = List.of(WEATHER, SYSTEM_STATUS);

    private final Clock clock;
    private final List<EnvironmentProbe> probes;

    public EnvironmentContextProvider(Clock clock, List<EnvironmentProbe> probes) {
        this.clock = clock;
        this.probes = probes == null ? List.of() : List.copyOf(probes);
    }

    public String describe() {
        List<String> lines = new ArrayList<>();
        lines.add("Time: " + LocalDateTime.now(clock).format(TIME_FORMAT));

        for (String label : STANDARD_LABELS) {
            lines.add(label + ": " + read(findProbe(label)));
        }
        for (EnvironmentProbe probe : probes) {
            if (!isStandard(probe.label())) {
                lines.add(probe.label() + ": " + read(Optional.of(probe)));
            }
        }

        return String.join("\n", lines);
    }

    private Optional<EnvironmentProbe> findProbe(String label) {
        return probes.stream()
            .filter(p -> label.equalsIgnoreCase(p.label()))
            .findFirst();
    }

    private String read(Optional<EnvironmentProbe> probe) {
        if (probe.isEmpty()) {
            return PENDING;
        }
        try {
            return probe.get().probe()
                .filter(value -> !value.isBlank())
                .orElse(PENDING);
        } catch (RuntimeException e) {
            // A failing probe degrades to the placeholder instead of failing the build
            log.warn("[ENVIRONMENT] Probe failed | label={} | error={}", probe.get().label(), e.getMessage());
            return PENDING;
        }
    }

    private boolean isStandard(String label) {
        return STANDARD_LABELS.stream().anyMatch(l -> l.equalsIgnoreCase(label));
    }
}
