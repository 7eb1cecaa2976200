package com.slicer.infrastructure.render;

import com.slicer.domain.model.HeaderType;
import com.slicer.engine.AggregationBrowser;
import com.slicer.engine.AggregationResult;
import com.slicer.engine.Attribute;
import com.slicer.engine.Cube;
import org.supercsv.io.CsvListWriter;
import org.supercsv.io.ICsvListWriter;
import org.supercsv.prefs.CsvPreference;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CSV output of aggregation results.
 *
 * Records are written one line at a time and flushed after each line, so a
 * large result never sits in memory as a whole.
 */
public final class CsvResultWriter {

    /** Header of the split indicator column. */
    public static final String SPLIT_HEADER = "Matches Filters";

    private CsvResultWriter() {
    }

    /**
     * Header row for the result.
     *
     * @return header values, null when no header row should be written
     */
    public static List<String> header(AggregationResult result, Cube cube, HeaderType headerType) {
        switch (headerType) {
            case NAMES:
                return nullIfEmpty(result.getLabels());
            case LABELS:
                List<String> header = new ArrayList<>();
                for (String label : result.getLabels()) {
                    if (AggregationBrowser.SPLIT_DIMENSION_NAME.equals(label)) {
                        header.add(SPLIT_HEADER);
                        continue;
                    }
                    for (Attribute attribute : cube.getAttributes(List.of(label), true)) {
                        header.add(attribute.getLabel() != null ? attribute.getLabel() : attribute.getName());
                    }
                }
                return nullIfEmpty(header);
            default:
                return null;
        }
    }

    /**
     * Write the header (if any) and one line per record. Values are taken
     * from each record by field name; missing values are written empty.
     * The output stream is flushed but not closed.
     */
    public static void write(OutputStream outputStream, List<String> header, List<String> fields,
                             Iterable<Map<String, Object>> records) throws IOException {
        Writer writer = new OutputStreamWriter(outputStream, StandardCharsets.UTF_8);
        ICsvListWriter csvWriter = new CsvListWriter(writer, CsvPreference.STANDARD_PREFERENCE);

        if (header != null) {
            csvWriter.writeHeader(header.toArray(new String[0]));
            csvWriter.flush();
        }

        for (Map<String, Object> record : records) {
            List<String> row = new ArrayList<>(fields.size());
            for (String field : fields) {
                Object value = record.get(field);
                row.add(value != null ? value.toString() : "");
            }
            csvWriter.write(row);
            csvWriter.flush();
        }
    }

    private static List<String> nullIfEmpty(List<String> header) {
        return header == null || header.isEmpty() ? null : header;
    }
}
