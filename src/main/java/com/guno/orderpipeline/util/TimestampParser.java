package com.guno.orderpipeline.util;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Timestamp Parser - raw timestamps to UTC instants.
 * Zone-less values are read as UTC; unparseable values yield null.
 */
@UtilityClass
@Slf4j
public class TimestampParser {

    private static final DateTimeFormatter[] LOCAL_FORMATTERS = {
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
    };

    public Instant parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return Instant.ofEpochMilli(node.longValue());
        }
        if (node.isTextual()) {
            return parse(node.asText());
        }
        log.debug("Ignoring non-scalar timestamp value: {}", node);
        return null;
    }

    public Instant parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        String text = value.trim();

        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            log.trace("Not an ISO instant: {}", text);
        }

        for (DateTimeFormatter formatter : LOCAL_FORMATTERS) {
            try {
                return LocalDateTime.parse(text, formatter).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                log.trace("Timestamp {} does not match {}", text, formatter);
            }
        }

        log.debug("Unparseable timestamp: {}", text);
        return null;
    }
}
