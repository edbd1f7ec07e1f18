package com.guno.orderpipeline.reader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.guno.orderpipeline.dto.raw.RawOrderRecord;
import com.guno.orderpipeline.exception.PipelineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads newline-delimited JSON, one order per line.
 *
 * Positions are 1-based line numbers so rejections point back at the file.
 * Blank lines are skipped; a line that does not parse still yields a record,
 * with a null payload and the parser message. Decimal literals are read
 * exactly rather than through double.
 */
@Component
@Slf4j
public class NdjsonOrderReader {

    private final ObjectReader jsonReader;

    public NdjsonOrderReader(ObjectMapper objectMapper) {
        // floats stay BigDecimal so amounts keep every digit
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    public List<RawOrderRecord> read(Path path) {
        log.info("📂 Reading orders from {}", path);
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.getFileName().toString());
        } catch (IOException e) {
            throw new PipelineException("Cannot read input " + path, e);
        }
    }

    public List<RawOrderRecord> read(Reader source, String sourceName) {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        List<RawOrderRecord> records = new ArrayList<>();
        int malformed = 0;
        long lineNumber = 0;

        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) continue;

                RawOrderRecord record = parseLine(line, lineNumber, sourceName);
                if (record.isMalformed()) malformed++;
                records.add(record);
            }
        } catch (IOException e) {
            throw new PipelineException("Failed reading " + sourceName + " at line " + lineNumber, e);
        }

        log.info("Read {} records from {} ({} malformed)", records.size(), sourceName, malformed);
        return records;
    }

    private RawOrderRecord parseLine(String line, long lineNumber, String sourceName) {
        try {
            JsonNode payload = jsonReader.readTree(line);
            return RawOrderRecord.builder()
                    .position(lineNumber)
                    .source(sourceName)
                    .payload(payload)
                    .parseError(payload.isObject() ? null : "Expected a JSON object but found " + payload.getNodeType())
                    .build();
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Unparseable line {} in {}: {}", lineNumber, sourceName, e.getOriginalMessage());
            return RawOrderRecord.builder()
                    .position(lineNumber)
                    .source(sourceName)
                    .parseError(e.getOriginalMessage())
                    .build();
        }
    }
}
