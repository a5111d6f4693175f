package com.consent.reconciliation.export;

import com.consent.reconciliation.report.ReportTable;
import com.consent.reconciliation.report.ReportTableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * HTML report exporter.
 *
 * <p>Writes a "Consent Report" heading and one table. The participant and comment
 * cells of each participant block are single cells spanning the block
 * ({@code rowspan}); comment line breaks become {@code <br>}. Word and spreadsheet
 * programs open the file as a regular table.</p>
 */
public class HtmlReportExporter implements ReportExporter {
    private static final Logger log = LoggerFactory.getLogger(HtmlReportExporter.class);

    private final String title;

    public HtmlReportExporter() {
        this("Consent Report");
    }

    public HtmlReportExporter(String title) {
        this.title = title;
    }

    @Override
    public ExportResult export(ReportTable table, Writer writer) {
        long rows = 0;
        try {
            writer.write("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n");
            writer.write("<title>" + escape(title) + "</title>\n");
            writer.write("<style>table{border-collapse:collapse}td,th{border:1px solid #000;"
                    + "padding:2px 6px;vertical-align:top}</style>\n");
            writer.write("</head>\n<body>\n");
            writer.write("<h1>" + escape(title) + "</h1>\n");
            writer.write("<table>\n<thead>\n<tr>");
            for (String header : ReportTable.HEADERS) {
                writer.write("<th>" + escape(header) + "</th>");
            }
            writer.write("</tr>\n</thead>\n<tbody>\n");

            for (ReportTableRow row : table.rows()) {
                writer.write("<tr>");
                if (row.startsSpan()) {
                    writer.write(spanningCell(row.participantCell(), row.rowSpan()));
                }
                writer.write("<td>" + escape(row.version()) + "</td>");
                writer.write("<td>" + escape(row.status()) + "</td>");
                if (row.startsSpan()) {
                    writer.write(spanningCell(row.commentCell(), row.rowSpan()));
                }
                writer.write("</tr>\n");
                rows++;
            }

            writer.write("</tbody>\n</table>\n</body>\n</html>\n");
            writer.flush();
        } catch (IOException e) {
            log.error("export.failed format=html rows={} error={}", rows, e.getMessage());
            throw new UncheckedIOException("HTML export failed after " + rows + " rows", e);
        }

        ExportResult result = new ExportResult(rows, table.spans().size());
        log.info("export.completed format=html result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "html";
    }

    private static String spanningCell(String value, int rowSpan) {
        String attribute = rowSpan > 1 ? " rowspan=\"" + rowSpan + "\"" : "";
        return "<td" + attribute + ">" + escape(value).replace("\n", "<br>") + "</td>";
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
