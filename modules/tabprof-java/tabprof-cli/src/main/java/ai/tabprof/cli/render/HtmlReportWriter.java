package ai.tabprof.cli.render;

import ai.tabprof.schema.ColumnSummary;
import ai.tabprof.schema.ProfileReport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Self-contained HTML page with one metrics table per column.
 */
public class HtmlReportWriter {

    private static final String STYLE = "body{font-family:Arial,Helvetica,sans-serif;padding:20px}"
        + "table{border-collapse:collapse;width:100%}"
        + "th,td{border:1px solid #ddd;padding:8px}"
        + "th{background:#f4f4f4;text-align:left}";

    public String toHtml(ProfileReport report) {
        StringBuilder html = new StringBuilder(4096);
        html.append("<!doctype html>\n")
            .append("<html><head><meta charset=\"utf-8\"><title>CSV Profile</title>\n")
            .append("<style>").append(STYLE).append("</style>\n")
            .append("</head><body>\n")
            .append(String.format("<h1>CSV Profile</h1><p>Rows: %s &nbsp; Duplicates: %s</p>%n",
                report.getRows(), report.getDuplicateRowCount()));

        for (Map.Entry<String, ColumnSummary> column : report.getColumns().entrySet()) {
            html.append("<h2>").append(escape(column.getKey())).append("</h2>\n")
                .append("<table>\n")
                .append("<tr><th>Metric</th><th>Value</th></tr>\n");
            for (Map.Entry<String, Object> metric : column.getValue().toMap().entrySet()) {
                html.append("<tr><td>").append(escape(metric.getKey())).append("</td><td>")
                    .append(renderValue(metric.getValue()))
                    .append("</td></tr>\n");
            }
            html.append("</table>\n");
        }

        html.append("</body></html>");
        return html.toString();
    }

    public void write(ProfileReport report, Path out) throws IOException {
        Files.write(out, toHtml(report).getBytes(StandardCharsets.UTF_8));
    }

    // top values render as "value (count)" lines
    private String renderValue(Object value) {
        if (value instanceof List) {
            return ((List<?>) value).stream()
                .map(v -> escape(String.valueOf(v)))
                .collect(Collectors.joining("<br>"));
        }
        return escape(String.valueOf(value));
    }

    static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '<':
                    escaped.append("&lt;");
                    break;
                case '>':
                    escaped.append("&gt;");
                    break;
                case '&':
                    escaped.append("&amp;");
                    break;
                case '"':
                    escaped.append("&quot;");
                    break;
                case '\'':
                    escaped.append("&#39;");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
