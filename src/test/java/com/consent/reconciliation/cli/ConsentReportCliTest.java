package com.consent.reconciliation.cli;

import com.consent.reconciliation.api.ParticipantOrder;
import com.consent.reconciliation.api.ReconciliationOptions;
import com.consent.reconciliation.catalog.LookupMode;
import com.consent.reconciliation.export.CsvReportExporter;
import com.consent.reconciliation.export.DocxReportExporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.*;

class ConsentReportCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private ConsentReportCli cli;

    private Path catalog;
    private Path signatures;
    private Path exits;

    @BeforeEach
    void setUp() throws IOException {
        cli = new ConsentReportCli(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        catalog = write("icf.csv", "ICF-Version;gültig ab\nV1;01.01.2020\nV2;01.01.2021\n");
        signatures = write("consent.csv", "mnpaid,icdat,mnp_rando_gr,mnp_rando_v6_gr\n"
                + "1001,2020-06-01,A,B\n"
                + "1002,2020-02-03,A,\n"
                + "1002,2021-01-15,C,D\n");
        exits = write("eos.csv", "mnpaid,eosdat,dthdat,eligible\n"
                + "1002,2021-02-01,2021-03-01,yes\n"
                + "1003,,,no\n");
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should write a CSV report to standard output")
    void csvToStdout() {
        int code = cli.run(new String[]{
                "--catalog", catalog.toString(),
                "--signatures", signatures.toString(),
                "--exits", exits.toString(),
                "--format", "csv"});

        assertEquals(ConsentReportCli.EXIT_OK, code);
        String report = stdout();
        assertTrue(report.startsWith("Patient-ID,Version of Informed Consent Form,Date of Consent,Comment\n"));
        assertTrue(report.contains("1001,V1,2020-06-01,A / B\n,V2,CHECK,\n"));
        assertTrue(report.contains("1002,V1,2020-02-03,\"A / -\nEOS (Death, 01.03.2021)\"\n,V2,2021-01-15,\n"));
        assertTrue(report.contains("1003,V1,n.a.,Screening Failure\n,V2,n.a.,\n"));
        assertTrue(stderr().contains("Report written: 6 rows, 3 participants, 0 data warnings"));
    }

    @Test
    @DisplayName("Should write an HTML report to a file")
    void htmlToFile() throws IOException {
        Path target = dir.resolve("report.html");

        int code = cli.run(new String[]{
                "--catalog", catalog.toString(),
                "--signatures", signatures.toString(),
                "--exits", exits.toString(),
                "--out", target.toString()});

        assertEquals(ConsentReportCli.EXIT_OK, code);
        String html = Files.readString(target, StandardCharsets.UTF_8);
        assertTrue(html.contains("<td rowspan=\"2\">1001</td>"));
        assertEquals("", stdout());
    }

    @Test
    @DisplayName("Should write a Word report to a file")
    void docxToFile() throws IOException {
        Path target = dir.resolve("consent_report.docx");

        int code = cli.run(new String[]{
                "--catalog", catalog.toString(),
                "--signatures", signatures.toString(),
                "--exits", exits.toString(),
                "--format", "docx",
                "--out", target.toString()});

        assertEquals(ConsentReportCli.EXIT_OK, code);
        String document = null;
        try (ZipInputStream zip = new ZipInputStream(Files.newInputStream(target))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.getName().equals("word/document.xml")) {
                    document = new String(zip.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
        }
        assertNotNull(document);
        assertTrue(document.contains("<w:t>Consent Report</w:t>"));
        assertTrue(document.contains("<w:vMerge w:val=\"restart\"/>"));
    }

    @Test
    @DisplayName("Missing required arguments print usage")
    void missingArguments() {
        int code = cli.run(new String[]{"--catalog", catalog.toString()});

        assertEquals(ConsentReportCli.EXIT_USAGE, code);
        assertTrue(stderr().startsWith("Usage:"));
    }

    @Test
    @DisplayName("Unknown option values print usage")
    void unknownFormat() {
        int code = cli.run(new String[]{
                "--catalog", catalog.toString(),
                "--signatures", signatures.toString(),
                "--exits", exits.toString(),
                "--format", "docx"});

        assertEquals(ConsentReportCli.EXIT_USAGE, code);
        assertTrue(stderr().contains("Unknown --format: docx"));
    }

    @Test
    @DisplayName("A catalog without usable rows is reported as a catalog error")
    void emptyCatalog() throws IOException {
        Path empty = write("empty.csv", "ICF-Version;gültig ab\nV1;\n");

        int code = cli.run(new String[]{
                "--catalog", empty.toString(),
                "--signatures", signatures.toString(),
                "--exits", exits.toString()});

        assertEquals(ConsentReportCli.EXIT_EMPTY_CATALOG, code);
        assertTrue(stderr().startsWith("Catalog error:"));
    }

    @Test
    @DisplayName("Unreadable inputs are reported as input errors")
    void missingInput() {
        int code = cli.run(new String[]{
                "--catalog", dir.resolve("absent.csv").toString(),
                "--signatures", signatures.toString(),
                "--exits", exits.toString()});

        assertEquals(ConsentReportCli.EXIT_INPUT_ERROR, code);
        assertTrue(stderr().startsWith("Input error:"));
    }

    @Nested
    @DisplayName("Argument parsing")
    class Arguments {

        @Test
        @DisplayName("Options map to lookup mode, order and threads")
        void options() {
            ReconciliationOptions options = ConsentReportCli.options(Map.of(
                    "--mode", "tied-latest", "--order", "first-seen", "--threads", "4"));

            assertEquals(LookupMode.TIED_LATEST, options.getLookupMode());
            assertEquals(ParticipantOrder.FIRST_SEEN, options.getParticipantOrder());
            assertEquals(4, options.getParallelism());
        }

        @Test
        @DisplayName("Invalid values are rejected")
        void invalidValues() {
            assertThrows(IllegalArgumentException.class, () -> ConsentReportCli.options(Map.of("--mode", "latest")));
            assertThrows(IllegalArgumentException.class, () -> ConsentReportCli.options(Map.of("--threads", "x")));
            assertThrows(IllegalArgumentException.class, () -> ConsentReportCli.options(Map.of("--threads", "0")));
        }

        @Test
        @DisplayName("Arguments are read as pairs")
        void parseArgs() {
            Map<String, String> args = ConsentReportCli.parseArgs(new String[]{"--a", "1", "--b", "2", "--dangling"});

            assertEquals(Map.of("--a", "1", "--b", "2"), args);
            assertInstanceOf(CsvReportExporter.class, ConsentReportCli.exporter("csv"));
            assertInstanceOf(DocxReportExporter.class, ConsentReportCli.exporter("docx"));
        }
    }
}
