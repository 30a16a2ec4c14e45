package org.unifi.petri;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

public class AppConfig {

    public enum ReportFormat { TEXT, JSON }

    private final Path netFile;
    private final ReportFormat format;

    AppConfig(Path netFile, ReportFormat format) {
        this.netFile = netFile;
        this.format = format;
    }

    /**
     * The net file is the first argument, otherwise PETRINET_FILE. PETRINET_REPORT_FORMAT selects
     * {@code text} (default) or {@code json}.
     *
     * @throws IllegalArgumentException if no file is given or the format is unknown
     */
    public static AppConfig load(String[] args, Map<String, String> env) {
        String file = args.length > 0 ? args[0] : env.get("PETRINET_FILE");
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("No net file given: pass it as argument or set PETRINET_FILE");
        }
        String format = env.getOrDefault("PETRINET_REPORT_FORMAT", "text");
        try {
            return new AppConfig(Paths.get(file), ReportFormat.valueOf(format.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report format: " + format, e);
        }
    }

    public Path getNetFile() {
        return netFile;
    }

    public ReportFormat getFormat() {
        return format;
    }
}
