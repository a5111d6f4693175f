package com.consent.reconciliation.cli;

import com.consent.reconciliation.api.CatalogConfigurationException;
import com.consent.reconciliation.api.ConsentInputs;
import com.consent.reconciliation.api.ConsentReportService;
import com.consent.reconciliation.api.ParticipantOrder;
import com.consent.reconciliation.api.ReconciliationOptions;
import com.consent.reconciliation.api.ReconciliationReport;
import com.consent.reconciliation.bulk.ConsentInputLoader;
import com.consent.reconciliation.bulk.TableReadException;
import com.consent.reconciliation.catalog.LookupMode;
import com.consent.reconciliation.core.model.DataQualityWarning;
import com.consent.reconciliation.export.CsvReportExporter;
import com.consent.reconciliation.export.DocxReportExporter;
import com.consent.reconciliation.export.ExportResult;
import com.consent.reconciliation.export.HtmlReportExporter;
import com.consent.reconciliation.export.ReportExporter;
import com.consent.reconciliation.rules.ColumnNormalizer;
import com.consent.reconciliation.rules.StudyMapping;
import com.consent.reconciliation.rules.StudyMappingException;
import com.consent.reconciliation.rules.StudyMappingLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Command line entry point: reads the catalog, signature and exit tables and writes
 * the consent report.
 *
 * Usage:
 *   java com.consent.reconciliation.cli.ConsentReportCli --catalog icf.csv --signatures consent.csv
 *       --exits eos.csv [--mapping study.json] [--mode interval|tied-latest] [--order id|first-seen]
 *       [--threads n] [--format csv|html|docx] [--out report.html]
 *
 * Catalog, signature and exit tables may be CSV, JSON or xlsx files. Without {@code --out}
 * the report goes to standard output.
 */
public class ConsentReportCli {
    private static final Logger log = LoggerFactory.getLogger(ConsentReportCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_EMPTY_CATALOG = 3;
    static final int EXIT_INPUT_ERROR = 4;

    private static final String USAGE = "Usage: ConsentReportCli --catalog <file> --signatures <file> --exits <file>"
            + " [--mapping <json>] [--mode interval|tied-latest] [--order id|first-seen] [--threads <n>]"
            + " [--format csv|html|docx] [--out <file>]";

    private final PrintStream out;
    private final PrintStream err;

    public ConsentReportCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new ConsentReportCli(System.out, System.err).run(args));
    }

    public int run(String[] args) {
        Map<String, String> cli = parseArgs(args);
        if (!cli.containsKey("--catalog") || !cli.containsKey("--signatures") || !cli.containsKey("--exits")) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        ReconciliationOptions options;
        ReportExporter exporter;
        try {
            options = options(cli);
            exporter = exporter(cli.getOrDefault("--format", "html"));
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            StudyMapping mapping = cli.containsKey("--mapping")
                    ? new StudyMappingLoader().load(Paths.get(cli.get("--mapping")))
                    : StudyMapping.empty();
            ConsentInputLoader loader = new ConsentInputLoader(new ColumnNormalizer(mapping));
            ConsentInputs inputs = loader.load(
                    Paths.get(cli.get("--catalog")),
                    Paths.get(cli.get("--signatures")),
                    Paths.get(cli.get("--exits")));

            ReconciliationReport report = new ConsentReportService(options).generate(inputs);
            for (DataQualityWarning warning : report.warnings()) {
                log.warn("input.warning {}", warning);
            }

            ExportResult result = write(report, exporter, cli.get("--out"));
            err.println("Report written: " + result.rowsWritten() + " rows, "
                    + report.participantCount() + " participants, "
                    + report.warnings().size() + " data warnings");
            return EXIT_OK;
        } catch (CatalogConfigurationException e) {
            err.println("Catalog error: " + e.getMessage());
            return EXIT_EMPTY_CATALOG;
        } catch (TableReadException | StudyMappingException | UncheckedIOException e) {
            log.error("report.failed error={}", e.getMessage());
            err.println("Input error: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }
    }

    private ExportResult write(ReconciliationReport report, ReportExporter exporter, String outPath) {
        if (outPath == null) {
            return exporter.export(report.table(), out);
        }
        Path target = Paths.get(outPath);
        try (OutputStream os = Files.newOutputStream(target)) {
            return exporter.export(report.table(), os);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target + ": " + e.getMessage(), e);
        }
    }

    static ReconciliationOptions options(Map<String, String> cli) {
        ReconciliationOptions.Builder builder = ReconciliationOptions.builder();
        String mode = cli.getOrDefault("--mode", "interval");
        switch (mode) {
            case "interval" -> builder.lookupMode(LookupMode.INTERVAL);
            case "tied-latest" -> builder.lookupMode(LookupMode.TIED_LATEST);
            default -> throw new IllegalArgumentException("Unknown --mode: " + mode);
        }
        String order = cli.getOrDefault("--order", "id");
        switch (order) {
            case "id" -> builder.participantOrder(ParticipantOrder.ASCENDING_ID);
            case "first-seen" -> builder.participantOrder(ParticipantOrder.FIRST_SEEN);
            default -> throw new IllegalArgumentException("Unknown --order: " + order);
        }
        if (cli.containsKey("--threads")) {
            try {
                builder.parallelism(Integer.parseInt(cli.get("--threads")));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--threads must be a number: " + cli.get("--threads"), e);
            }
        }
        return builder.build();
    }

    static ReportExporter exporter(String format) {
        return switch (format) {
            case "csv" -> new CsvReportExporter();
            case "html" -> new HtmlReportExporter();
            case "docx" -> new DocxReportExporter();
            default -> throw new IllegalArgumentException("Unknown --format: " + format);
        };
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        for (int i = 0; i < args.length - 1; i += 2) {
            m.put(args[i], args[i + 1]);
        }
        return m;
    }
}
