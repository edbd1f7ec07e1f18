package com.guno.orderpipeline.export;

import com.guno.orderpipeline.entity.FlatRow;
import com.guno.orderpipeline.exception.PipelineException;
import com.guno.orderpipeline.mapper.FlatRowColumns;
import com.guno.orderpipeline.util.CsvFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes flat rows as CSV with a header row. The campaign_flag column is
 * written only when at least one row carries a flag.
 */
@Component
@Slf4j
public class FlatRowCsvExporter {

    public int export(List<FlatRow> rows, Path target) {
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                int written = export(rows, writer);
                log.info("📄 Exported {} rows to {}", written, target);
                return written;
            }
        } catch (IOException e) {
            throw new PipelineException("Cannot export flat rows to " + target, e);
        }
    }

    public int export(List<FlatRow> rows, Writer writer) throws IOException {
        List<String> columns = new ArrayList<>(FlatRowColumns.SCHEMA.getColumnNames());
        boolean withFlag = rows.stream().anyMatch(r -> r.getCampaignFlag() != null);
        if (withFlag) {
            columns.add(FlatRowColumns.CAMPAIGN_FLAG);
        }

        writer.write(CsvFormatter.joinCsvRow(columns.toArray()));
        writer.write("\n");
        for (FlatRow row : rows) {
            Map<String, Object> values = FlatRowColumns.toColumns(row);
            writer.write(CsvFormatter.joinCsvRow(columns.stream().map(values::get).toArray()));
            writer.write("\n");
        }
        writer.flush();
        return rows.size();
    }
}
