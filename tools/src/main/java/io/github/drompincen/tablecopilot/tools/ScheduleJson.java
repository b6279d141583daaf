package io.github.drompincen.tablecopilot.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.tablecopilot.persistence.document.ScheduleDocument;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/** Shared helpers for the schedule tools. */
final class ScheduleJson {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    static final String STORE_UNAVAILABLE = "Schedule store not available";

    private ScheduleJson() {}

    static ObjectNode toJson(ScheduleDocument doc) {
        return MAPPER.valueToTree(doc);
    }

    static ArrayNode toJson(List<ScheduleDocument> docs) {
        ArrayNode array = MAPPER.createArrayNode();
        docs.forEach(d -> array.add(toJson(d)));
        return array;
    }

    static Optional<LocalDateTime> parseDatetime(String text) {
        try {
            return Optional.of(LocalDateTime.parse(text.trim(), ScheduleDocument.DATETIME_FORMAT));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static String badDatetime(String text) {
        return "Invalid datetime '" + text + "'. Use " + ScheduleDocument.DATETIME_PATTERN
                + ", for example 2026-03-15 19:30";
    }
}
