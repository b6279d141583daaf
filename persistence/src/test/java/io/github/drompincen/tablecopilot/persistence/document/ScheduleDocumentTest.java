package io.github.drompincen.tablecopilot.persistence.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.tablecopilot.protocol.api.Recurrence;
import io.github.drompincen.tablecopilot.protocol.api.ScheduleStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleDocumentTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void serializesSnakeCaseAndMinutePrecisionDatetime() {
        ScheduleDocument doc = new ScheduleDocument();
        doc.setId("ab12cd34");
        doc.setTitle("Dinner at Luigi's");
        doc.setDatetime(LocalDateTime.of(2026, 10, 20, 19, 30));
        doc.setRecurrence(Recurrence.WEEKLY);
        doc.setReminderMinutes(15);

        JsonNode json = mapper.valueToTree(doc);

        assertThat(json.get("datetime").asText()).isEqualTo("2026-10-20 19:30");
        assertThat(json.get("reminder_minutes").asInt()).isEqualTo(15);
        assertThat(json.get("status").asText()).isEqualTo("pending");
        assertThat(json.get("recurrence").asText()).isEqualTo("weekly");
        assertThat(json.has("notified_at")).isFalse();
    }

    @Test
    void readsRecordWithoutOptionalFields() throws Exception {
        ScheduleDocument doc = mapper.readValue(
                "{\"id\":\"x1\",\"title\":\"Lunch\",\"datetime\":\"2026-01-02 12:00\",\"status\":\"notified\",\"extra\":1}",
                ScheduleDocument.class);

        assertThat(doc.getReminderMinutes()).isZero();
        assertThat(doc.getRecurrence()).isEqualTo(Recurrence.ONCE);
        assertThat(doc.getStatus()).isEqualTo(ScheduleStatus.NOTIFIED);
    }

    @Test
    void dueWhenLeadTimeReached() {
        ScheduleDocument doc = new ScheduleDocument();
        doc.setDatetime(LocalDateTime.of(2026, 10, 20, 19, 30));
        doc.setReminderMinutes(15);

        assertThat(doc.isDue(LocalDateTime.of(2026, 10, 20, 19, 14))).isFalse();
        assertThat(doc.isDue(LocalDateTime.of(2026, 10, 20, 19, 15))).isTrue();

        doc.transitionTo(ScheduleStatus.NOTIFIED);
        assertThat(doc.isDue(LocalDateTime.of(2026, 10, 20, 20, 0))).isFalse();
    }

    @Test
    void cancelledRecordCannotBeNotified() {
        ScheduleDocument doc = new ScheduleDocument();
        doc.setId("c1");
        doc.transitionTo(ScheduleStatus.CANCELLED);

        assertThatThrownBy(() -> doc.transitionTo(ScheduleStatus.NOTIFIED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("c1");
    }
}
