package com.vigil.agent.infrastructure.checks;

import com.vigil.observability.Checker;
import com.vigil.status.ProbeResult;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Fails when the usable space of the file store holding {@code path} drops below a ratio of its
 * total size.
 */
public final class DiskSpaceChecker implements Checker {

    public static final String NAME = "disk";

    private final Path path;
    private final double minFreeRatio;

    public DiskSpaceChecker(Path path, double minFreeRatio) {
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        if (minFreeRatio < 0 || minFreeRatio > 1) {
            throw new IllegalArgumentException("minFreeRatio must be between 0 and 1, got " + minFreeRatio);
        }
        this.path = path;
        this.minFreeRatio = minFreeRatio;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProbeResult run(String node, Duration budget) throws IOException {
        FileStore store = Files.getFileStore(path);
        long total = store.getTotalSpace();
        if (total <= 0) {
            return ProbeResult.passed(node, NAME, "no capacity reported for " + path);
        }
        double freeRatio = (double) store.getUsableSpace() / total;
        String detail = String.format(Locale.ROOT, "%.1f%% free on %s", freeRatio * 100, path);
        return freeRatio < minFreeRatio
                ? ProbeResult.failed(node, NAME, detail)
                : ProbeResult.passed(node, NAME, detail);
    }
}
