package io.github.drompincen.tablecopilot.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tablecopilot.persistence.document.ScheduleDocument;
import io.github.drompincen.tablecopilot.persistence.store.ScheduleStore;
import io.github.drompincen.tablecopilot.runtime.tools.ToolResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;

import static io.github.drompincen.tablecopilot.tools.ScheduleToolTestSupport.CTX;
import static org.assertj.core.api.Assertions.assertThat;

class DeleteScheduleToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void deletesExistingAndReportsMissing() {
        ScheduleStore store = ScheduleToolTestSupport.store(tempDir);
        DeleteScheduleTool tool = new DeleteScheduleTool();
        tool.setScheduleStore(store);

        ScheduleDocument doc = new ScheduleDocument();
        doc.setTitle("Lunch");
        doc.setDatetime(LocalDateTime.of(2026, 10, 20, 12, 0));
        String id = store.create(doc).getId();

        ToolResult deleted = tool.execute(CTX, MAPPER.createObjectNode().put("schedule_id", id));
        ToolResult missing = tool.execute(CTX, MAPPER.createObjectNode().put("schedule_id", id));

        assertThat(deleted.success()).isTrue();
        assertThat(deleted.message()).contains("Lunch");
        assertThat(store.list()).isEmpty();
        assertThat(missing.success()).isFalse();
        assertThat(missing.error()).contains(id);
    }
}
