package ai.tabprof.cli.render;

import java.util.Optional;

public enum ReportFormat {

    JSON,
    HTML;

    public static Optional<ReportFormat> fromString(String value) {
        for (ReportFormat format : values()) {
            if (format.name().equalsIgnoreCase(value)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
