package com.myorg.tocparser.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage timer for one pipeline run. Writes to the {@code performance} logger.
 */
public class PerfProbe {
    private static final Logger PERF = LoggerFactory.getLogger("performance");

    private final long t0 = System.nanoTime();
    private long last = t0;
    private final String label;

    public PerfProbe(String label) { this.label = label; }

    public void mark(String stepName, long unitsProcessed) {
        long now = System.nanoTime();
        double ms = (now - last) / 1_000_000.0;
        double sec = ms / 1000.0;
        last = now;

        double rate = (sec > 0) ? (unitsProcessed / sec) : 0.0;

        Runtime rt = Runtime.getRuntime();
        double usedMB = (rt.totalMemory() - rt.freeMemory()) / (1024.0 * 1024.0);

        PERF.info("{} - {} in {} ms ({} items, {} items/s), Memory: {} MB",
                label,
                stepName,
                String.format("%.2f", ms),
                unitsProcessed,
                String.format("%.1f", rate),
                String.format("%.2f", usedMB)
        );
    }

    public void done(String stepName) {
        double totalMs = (System.nanoTime() - t0) / 1_000_000.0;
        PERF.info("{} - {} total {} ms", label, stepName, String.format("%.2f", totalMs));
    }
}
