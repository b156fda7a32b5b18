package com.contextkit.core.environment;

import com.contextkit.core.source.EnvironmentProbe;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.Locale;
import java.util.Optional;

/**
 * Reports system load average and JVM heap usage.
 */
public class SystemLoadProbe implements EnvironmentProbe {

    private static final long MB = 1024 * 1024;

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public String label() {
        return EnvironmentContextProvider.SYSTEM_STATUS;
    }

    @Override
    public Optional<String> probe() {
        Runtime runtime = Runtime.getRuntime();
        long usedMb = (runtime.totalMemory() - runtime.freeMemory()) / MB;
        long maxMb = runtime.maxMemory() / MB;

        StringBuilder status = new StringBuilder();
        double load = os.getSystemLoadAverage();
        if (load >= 0) {
            status.append(String.format(Locale.ROOT, "load %.2f (%d cpus), ", load, os.getAvailableProcessors()));
        }
        status.append("heap ").append(usedMb).append("/").append(maxMb).append(" MB");
        return Optional.of(status.toString());
    }
}
