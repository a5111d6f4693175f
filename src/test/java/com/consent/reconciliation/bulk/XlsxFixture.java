package com.consent.reconciliation.bulk;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds small xlsx workbooks for reader tests.
 *
 * <p>Cell values: a {@link String} becomes a shared string, a {@link LocalDate} a date
 * serial with a date style, a {@link Number} a plain numeric cell, a {@link Boolean}
 * a boolean cell and {@code null} an absent cell.</p>
 */
final class XlsxFixture {

    private final Map<String, List<List<Object>>> sheets = new LinkedHashMap<>();
    private final List<String> sharedStrings = new ArrayList<>();

    static XlsxFixture workbook() {
        return new XlsxFixture();
    }

    XlsxFixture sheet(String name, List<List<Object>> rows) {
        sheets.put(name, rows);
        return this;
    }

    Path write(Path file) throws IOException {
        Files.write(file, toBytes());
        return file;
    }

    byte[] toBytes() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(bytes)) {
            StringBuilder workbook = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                    + "<workbook xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\""
                    + " xmlns:r=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships\"><sheets>");
            StringBuilder rels = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                    + "<Relationships xmlns=\"http://schemas.openxmlformats.org/package/2006/relationships\">");
            int index = 0;
            for (Map.Entry<String, List<List<Object>>> sheet : sheets.entrySet()) {
                index++;
                workbook.append("<sheet name=\"").append(sheet.getKey()).append("\" sheetId=\"").append(index)
                        .append("\" r:id=\"rId").append(index).append("\"/>");
                rels.append("<Relationship Id=\"rId").append(index)
                        .append("\" Type=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships/worksheet\"")
                        .append(" Target=\"worksheets/sheet").append(index).append(".xml\"/>");
                putEntry(zos, "xl/worksheets/sheet" + index + ".xml", sheetXml(sheet.getValue()));
            }
            workbook.append("</sheets></workbook>");
            rels.append("</Relationships>");
            putEntry(zos, "xl/workbook.xml", workbook.toString());
            putEntry(zos, "xl/_rels/workbook.xml.rels", rels.toString());
            putEntry(zos, "xl/sharedStrings.xml", sharedStringsXml());
            putEntry(zos, "xl/styles.xml", "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                    + "<styleSheet xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\">"
                    + "<numFmts count=\"1\"><numFmt numFmtId=\"164\" formatCode=\"dd\\.mm\\.yyyy\"/></numFmts>"
                    + "<cellXfs count=\"3\"><xf numFmtId=\"0\"/><xf numFmtId=\"164\"/><xf numFmtId=\"2\"/></cellXfs>"
                    + "</styleSheet>");
        }
        return bytes.toByteArray();
    }

    private String sheetXml(List<List<Object>> rows) {
        StringBuilder xml = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<worksheet xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\"><sheetData>");
        for (int r = 0; r < rows.size(); r++) {
            xml.append("<row r=\"").append(r + 1).append("\">");
            List<Object> row = rows.get(r);
            for (int c = 0; c < row.size(); c++) {
                Object value = row.get(c);
                if (value == null) {
                    continue;
                }
                String ref = (char) ('A' + c) + String.valueOf(r + 1);
                if (value instanceof String text) {
                    xml.append("<c r=\"").append(ref).append("\" t=\"s\"><v>").append(share(text)).append("</v></c>");
                } else if (value instanceof LocalDate date) {
                    long serial = ChronoUnit.DAYS.between(LocalDate.of(1899, 12, 30), date);
                    xml.append("<c r=\"").append(ref).append("\" s=\"1\"><v>").append(serial).append("</v></c>");
                } else if (value instanceof Boolean flag) {
                    xml.append("<c r=\"").append(ref).append("\" t=\"b\"><v>").append(flag ? 1 : 0).append("</v></c>");
                } else {
                    xml.append("<c r=\"").append(ref).append("\" s=\"2\"><v>").append(value).append("</v></c>");
                }
            }
            xml.append("</row>");
        }
        return xml.append("</sheetData></worksheet>").toString();
    }

    private int share(String text) {
        int index = sharedStrings.indexOf(text);
        if (index < 0) {
            sharedStrings.add(text);
            index = sharedStrings.size() - 1;
        }
        return index;
    }

    private String sharedStringsXml() {
        StringBuilder xml = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<sst xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\">");
        for (String text : sharedStrings) {
            xml.append("<si><t xml:space=\"preserve\">").append(escape(text)).append("</t></si>");
        }
        return xml.append("</sst>").toString();
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private static void putEntry(ZipOutputStream zos, String name, String xml) throws IOException {
        zos.putNextEntry(new ZipEntry(name));
        zos.write(xml.getBytes(StandardCharsets.UTF_8));
        zos.closeEntry();
    }
}
