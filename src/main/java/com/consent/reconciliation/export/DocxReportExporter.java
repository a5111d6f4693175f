package com.consent.reconciliation.export;

import com.consent.reconciliation.report.ReportTable;
import com.consent.reconciliation.report.ReportTableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Word document (.docx) report exporter.
 *
 * <p>Writes a "Consent Report" heading and one bordered table. The participant and
 * comment cells of each participant block are vertically merged
 * ({@code w:vMerge}); comment line breaks become {@code w:br}.</p>
 *
 * <p>The document is a zip package, so only {@link #export(ReportTable, OutputStream)}
 * is supported. The stream is finished and flushed, not closed.</p>
 */
public class DocxReportExporter implements ReportExporter {
    private static final Logger log = LoggerFactory.getLogger(DocxReportExporter.class);

    private static final String XML_HEADER = "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\n";
    private static final String W_NS = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    private static final String REL_TYPE = "http://schemas.openxmlformats.org/officeDocument/2006/relationships/";

    private final String title;

    public DocxReportExporter() {
        this("Consent Report");
    }

    public DocxReportExporter(String title) {
        this.title = title;
    }

    @Override
    public ExportResult export(ReportTable table, Writer writer) {
        throw new UnsupportedOperationException("docx is a binary format; export to an output stream");
    }

    @Override
    public ExportResult export(ReportTable table, OutputStream output) {
        String document = documentXml(table);
        try {
            ZipOutputStream zos = new ZipOutputStream(output);
            putEntry(zos, "[Content_Types].xml", contentTypesXml());
            putEntry(zos, "_rels/.rels", relationshipsXml("rId1", "officeDocument", "word/document.xml"));
            putEntry(zos, "word/_rels/document.xml.rels", relationshipsXml("rId1", "styles", "styles.xml"));
            putEntry(zos, "word/styles.xml", stylesXml());
            putEntry(zos, "word/document.xml", document);
            zos.finish();
            zos.flush();
        } catch (IOException e) {
            log.error("export.failed format=docx rows={} error={}", table.rows().size(), e.getMessage());
            throw new UncheckedIOException("DOCX export failed", e);
        }

        ExportResult result = new ExportResult(table.rows().size(), table.spans().size());
        log.info("export.completed format=docx result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "docx";
    }

    String documentXml(ReportTable table) {
        StringBuilder xml = new StringBuilder(XML_HEADER);
        xml.append("<w:document xmlns:w=\"").append(W_NS).append("\"><w:body>");
        xml.append("<w:p><w:pPr><w:pStyle w:val=\"Heading1\"/></w:pPr><w:r><w:t>")
                .append(escape(title)).append("</w:t></w:r></w:p>");

        xml.append("<w:tbl><w:tblPr><w:tblStyle w:val=\"TableGrid\"/><w:tblW w:w=\"0\" w:type=\"auto\"/></w:tblPr>");
        xml.append("<w:tblGrid>");
        for (int i = 0; i < ReportTable.HEADERS.size(); i++) {
            xml.append("<w:gridCol/>");
        }
        xml.append("</w:tblGrid>");

        xml.append("<w:tr><w:trPr><w:tblHeader/></w:trPr>");
        for (String header : ReportTable.HEADERS) {
            xml.append("<w:tc><w:p><w:r><w:rPr><w:b/></w:rPr><w:t>").append(escape(header))
                    .append("</w:t></w:r></w:p></w:tc>");
        }
        xml.append("</w:tr>");

        for (ReportTableRow row : table.rows()) {
            xml.append("<w:tr>");
            xml.append(mergedCell(row, row.participantCell()));
            xml.append(cell(null, row.version()));
            xml.append(cell(null, row.status()));
            xml.append(mergedCell(row, row.commentCell()));
            xml.append("</w:tr>");
        }

        xml.append("</w:tbl><w:p/></w:body></w:document>");
        return xml.toString();
    }

    /**
     * Opens a vertical merge on the first row of a multi-row block and continues it
     * on the following rows.
     */
    private static String mergedCell(ReportTableRow row, String value) {
        if (!row.startsSpan()) {
            return cell("<w:vMerge/>", "");
        }
        return cell(row.rowSpan() > 1 ? "<w:vMerge w:val=\"restart\"/>" : null, value);
    }

    private static String cell(String properties, String value) {
        StringBuilder xml = new StringBuilder("<w:tc>");
        if (properties != null) {
            xml.append("<w:tcPr>").append(properties).append("</w:tcPr>");
        }
        xml.append("<w:p>");
        if (value != null && !value.isEmpty()) {
            xml.append("<w:r>");
            String[] lines = value.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    xml.append("<w:br/>");
                }
                xml.append("<w:t xml:space=\"preserve\">").append(escape(lines[i])).append("</w:t>");
            }
            xml.append("</w:r>");
        }
        return xml.append("</w:p></w:tc>").toString();
    }

    private static String contentTypesXml() {
        return XML_HEADER
                + "<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\">"
                + "<Default Extension=\"rels\" ContentType=\"application/vnd.openxmlformats-package.relationships+xml\"/>"
                + "<Default Extension=\"xml\" ContentType=\"application/xml\"/>"
                + "<Override PartName=\"/word/document.xml\" ContentType=\"application/"
                + "vnd.openxmlformats-officedocument.wordprocessingml.document.main+xml\"/>"
                + "<Override PartName=\"/word/styles.xml\" ContentType=\"application/"
                + "vnd.openxmlformats-officedocument.wordprocessingml.styles+xml\"/>"
                + "</Types>";
    }

    private static String relationshipsXml(String id, String type, String target) {
        return XML_HEADER
                + "<Relationships xmlns=\"http://schemas.openxmlformats.org/package/2006/relationships\">"
                + "<Relationship Id=\"" + id + "\" Type=\"" + REL_TYPE + type + "\" Target=\"" + target + "\"/>"
                + "</Relationships>";
    }

    private static String stylesXml() {
        StringBuilder borders = new StringBuilder();
        for (String side : new String[]{"top", "left", "bottom", "right", "insideH", "insideV"}) {
            borders.append("<w:").append(side).append(" w:val=\"single\" w:sz=\"4\" w:space=\"0\" w:color=\"000000\"/>");
        }
        return XML_HEADER
                + "<w:styles xmlns:w=\"" + W_NS + "\">"
                + "<w:style w:type=\"paragraph\" w:default=\"1\" w:styleId=\"Normal\"><w:name w:val=\"Normal\"/>"
                + "</w:style>"
                + "<w:style w:type=\"paragraph\" w:styleId=\"Heading1\"><w:name w:val=\"heading 1\"/>"
                + "<w:basedOn w:val=\"Normal\"/><w:next w:val=\"Normal\"/>"
                + "<w:pPr><w:keepNext/><w:spacing w:before=\"240\" w:after=\"120\"/><w:outlineLvl w:val=\"0\"/></w:pPr>"
                + "<w:rPr><w:b/><w:sz w:val=\"32\"/></w:rPr></w:style>"
                + "<w:style w:type=\"table\" w:styleId=\"TableGrid\"><w:name w:val=\"Table Grid\"/>"
                + "<w:tblPr><w:tblBorders>" + borders + "</w:tblBorders></w:tblPr></w:style>"
                + "</w:styles>";
    }

    private static void putEntry(ZipOutputStream zos, String name, String xml) throws IOException {
        zos.putNextEntry(new ZipEntry(name));
        zos.write(xml.getBytes(StandardCharsets.UTF_8));
        zos.closeEntry();
    }

    /**
     * Escapes XML markup and drops control characters XML 1.0 cannot carry.
     */
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
                default -> {
                    if (c >= 0x20 || c == '\t' || c == '\n' || c == '\r') {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }
}
