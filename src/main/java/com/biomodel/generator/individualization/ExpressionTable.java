package com.biomodel.generator.individualization;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalized gene expression levels (TPM) per gene and sample, read from a CSV
 * file whose header names the samples and one column holds gene symbols.
 */
public class ExpressionTable {
    private static final Logger log = LoggerFactory.getLogger(ExpressionTable.class);

    public static final int DEFAULT_GENE_COLUMN = 2;

    private final List<String> columns;
    private final Map<String, Map<String, String>> rows;

    private ExpressionTable(List<String> columns, Map<String, Map<String, String>> rows) {
        this.columns = List.copyOf(columns);
        this.rows = rows;
    }

    public static ExpressionTable fromCsv(Path csvFile) throws IOException {
        return fromCsv(csvFile, DEFAULT_GENE_COLUMN);
    }

    public static ExpressionTable fromCsv(Path csvFile, int geneColumn) throws IOException {
        try (Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8)) {
            return read(reader, geneColumn);
        }
    }

    static ExpressionTable read(Reader reader, int geneColumn) throws IOException {
        try (CSVParser parser = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .build()
                .parse(reader)) {
            return read(parser, geneColumn);
        }
    }

    private static ExpressionTable read(CSVParser parser, int geneColumn) {
        List<String> header = parser.getHeaderNames();
        if (geneColumn < 0 || geneColumn >= header.size()) {
            throw new IllegalArgumentException("Gene column " + geneColumn
                    + " is out of range for a table with " + header.size() + " columns");
        }
        List<String> columns = new ArrayList<>(header);
        columns.remove(geneColumn);

        Map<String, Map<String, String>> rows = new LinkedHashMap<>();
        for (CSVRecord record : parser) {
            String gene = record.get(geneColumn).trim();
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                if (i != geneColumn && i < record.size()) {
                    values.put(header.get(i), record.get(i).trim());
                }
            }
            if (rows.put(gene, values) != null) {
                log.warn("Gene {} appears more than once; keeping the last row", gene);
            }
        }
        log.debug("Loaded expression of {} genes across {} columns", rows.size(), columns.size());
        return new ExpressionTable(columns, rows);
    }

    /**
     * Header names other than the gene column, typically sample identifiers.
     */
    public List<String> getColumns() {
        return columns;
    }

    public List<String> getGenes() {
        return Collections.unmodifiableList(new ArrayList<>(rows.keySet()));
    }

    public boolean containsGene(String gene) {
        return rows.containsKey(gene);
    }

    /**
     * @throws IllegalArgumentException if the gene or sample is unknown or the cell is not a number
     */
    public double tpm(String gene, String sample) {
        Map<String, String> row = rows.get(gene);
        if (row == null) {
            throw new IllegalArgumentException("Gene " + gene + " is not in the expression table");
        }
        String value = row.get(sample);
        if (value == null) {
            throw new IllegalArgumentException("Sample " + sample + " is not in the expression table");
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expression of " + gene + " in " + sample
                    + " is not a number: '" + value + "'", e);
        }
    }
}
