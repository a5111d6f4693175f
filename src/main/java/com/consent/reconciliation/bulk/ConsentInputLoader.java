package com.consent.reconciliation.bulk;

import com.consent.reconciliation.api.ConsentInputs;
import com.consent.reconciliation.core.model.CatalogVersion;
import com.consent.reconciliation.core.model.DataQualityWarning;
import com.consent.reconciliation.core.model.EligibilityRecord;
import com.consent.reconciliation.core.model.ExitRecord;
import com.consent.reconciliation.core.model.SignatureEvent;
import com.consent.reconciliation.logging.LogContext;
import com.consent.reconciliation.rules.ColumnNormalizer;
import com.consent.reconciliation.rules.TableKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads and normalizes the three input tables of a report run.
 * The reader is chosen by file extension: {@code .json} is read as JSON, {@code .xlsx} as an
 * Excel workbook, anything else as CSV. A catalog workbook is read from its {@value #CATALOG_SHEET}
 * sheet when it has one, the other workbooks from their first sheet.
 */
public class ConsentInputLoader {
    private static final Logger log = LoggerFactory.getLogger(ConsentInputLoader.class);
    public static final String CATALOG_SHEET = "ICF2";

    private final TableReader csvReader;
    private final TableReader jsonReader;
    private final TableReader xlsxReader;
    private final TableReader catalogXlsxReader;
    private final CatalogImporter catalogImporter;
    private final SignatureEventImporter signatureImporter;
    private final ExitRecordImporter exitImporter;
    private final EligibilityImporter eligibilityImporter;

    public ConsentInputLoader(ColumnNormalizer normalizer) {
        this(normalizer, new CsvTableReader(), new JsonTableReader());
    }

    public ConsentInputLoader(ColumnNormalizer normalizer, TableReader csvReader, TableReader jsonReader) {
        Objects.requireNonNull(normalizer, "normalizer is required");
        this.csvReader = Objects.requireNonNull(csvReader, "csvReader is required");
        this.jsonReader = Objects.requireNonNull(jsonReader, "jsonReader is required");
        this.xlsxReader = new XlsxTableReader();
        this.catalogXlsxReader = new XlsxTableReader(CATALOG_SHEET);
        this.catalogImporter = new CatalogImporter(normalizer);
        this.signatureImporter = new SignatureEventImporter(normalizer);
        this.exitImporter = new ExitRecordImporter(normalizer);
        this.eligibilityImporter = new EligibilityImporter(normalizer);
    }

    public ConsentInputs load(Path catalog, Path signatures, Path exits) {
        return load(catalog, signatures, exits, ProgressCallback.NOOP);
    }

    public ConsentInputs load(Path catalog, Path signatures, Path exits, ProgressCallback callback) {
        return load(readerFor(catalog, TableKind.CATALOG).read(catalog),
                readerFor(signatures, TableKind.SIGNATURES).read(signatures),
                readerFor(exits, TableKind.EXITS).read(exits),
                callback);
    }

    /**
     * Normalizes tables that were already read.
     */
    public ConsentInputs load(RawTable catalog, RawTable signatures, RawTable exits, ProgressCallback callback) {
        String loadId = LogContext.generateRunId();
        ImportResult<CatalogVersion> catalogResult = importTable(loadId, catalogImporter, catalog, callback);
        ImportResult<SignatureEvent> signatureResult = importTable(loadId, signatureImporter, signatures, callback);
        ImportResult<ExitRecord> exitResult = importTable(loadId, exitImporter, exits, callback);
        ImportResult<EligibilityRecord> eligibilityResult = importTable(loadId, eligibilityImporter, exits, callback);

        List<DataQualityWarning> warnings = new ArrayList<>();
        warnings.addAll(catalogResult.warnings());
        warnings.addAll(signatureResult.warnings());
        warnings.addAll(exitResult.warnings());
        warnings.addAll(eligibilityResult.warnings());

        log.info("inputs.loaded versions={} signatures={} exits={} eligibility={} warnings={}",
                catalogResult.recordCount(), signatureResult.recordCount(), exitResult.recordCount(),
                eligibilityResult.recordCount(), warnings.size());
        return new ConsentInputs(catalogResult.records(), signatureResult.records(), exitResult.records(),
                eligibilityResult.records(), warnings);
    }

    private static <T> ImportResult<T> importTable(String loadId, TableImporter<T> importer, RawTable table,
                                                   ProgressCallback callback) {
        try (LogContext ctx = LogContext.forImport(loadId, importer.getTableKind().label())) {
            return importer.importRecords(table, callback);
        }
    }

    TableReader readerFor(Path path, TableKind table) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return jsonReader;
        }
        if (name.endsWith(".xlsx")) {
            return table == TableKind.CATALOG ? catalogXlsxReader : xlsxReader;
        }
        return csvReader;
    }
}
