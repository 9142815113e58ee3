package com.vgen.config.settings;

import com.vgen.config.ConfigValue;

import java.util.LinkedHashMap;
import java.util.Map;

public final class IoSettings {

    public static final IoSettings DEFAULTS = new IoSettings("tool/ai_archive", true, false, false);

    private final String archiveDir;
    private final boolean dryRun;
    private final boolean verbose;
    private final boolean failFast;

    public IoSettings(String archiveDir, boolean dryRun, boolean verbose, boolean failFast) {
        this.archiveDir = archiveDir != null && !archiveDir.isBlank() ? archiveDir : "tool/ai_archive";
        this.dryRun = dryRun;
        this.verbose = verbose;
        this.failFast = failFast;
    }

    public static IoSettings from(ConfigValue section) {
        return new IoSettings(
                section.get("archive_dir").asString(DEFAULTS.archiveDir),
                section.get("dry_run").asBoolean(DEFAULTS.dryRun),
                section.get("verbose").asBoolean(DEFAULTS.verbose),
                section.get("fail_fast").asBoolean(DEFAULTS.failFast));
    }

    public String getArchiveDir() {
        return archiveDir;
    }

    /** Dry run forces mock generation; the archive record is still written. */
    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isFailFast() {
        return failFast;
    }

    public Map<String, Object> toSnapshot() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("archive_dir", archiveDir);
        m.put("dry_run", dryRun);
        m.put("verbose", verbose);
        m.put("fail_fast", failFast);
        return m;
    }
}
