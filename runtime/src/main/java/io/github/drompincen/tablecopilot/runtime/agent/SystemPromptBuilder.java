package io.github.drompincen.tablecopilot.runtime.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tablecopilot.protocol.api.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders the system prompt for each completion from the
 * {@code prompts/system_prompt.txt} template.
 */
@Component
public class SystemPromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(SystemPromptBuilder.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String TEMPLATE_RESOURCE = "prompts/system_prompt.txt";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm (EEEE)");

    static final String FALLBACK_TEMPLATE = """
            You are Table Copilot ({{MODEL_NAME}}), a reservation and schedule assistant. \
            The current time is {{CURRENT_TIME}}. Call tools with \
            <tool_call>{"name":"...","args":{...}}</tool_call>.
            Available tools:
            {{TOOLS}}""";

    private final String modelName;
    private final Clock clock;
    private final String template;

    @Autowired
    public SystemPromptBuilder(@Value("${spring.ai.openai.chat.options.model:moonshotai/kimi-k2.5}") String modelName,
                               Clock clock) {
        this(modelName, clock, loadTemplate());
    }

    public SystemPromptBuilder(String modelName, Clock clock, String template) {
        this.modelName = modelName;
        this.clock = clock;
        this.template = template;
    }

    public String build(List<ToolDescriptor> tools) {
        return template
                .replace("{{MODEL_NAME}}", modelName)
                .replace("{{CURRENT_TIME}}", LocalDateTime.now(clock).format(TIME_FORMAT))
                .replace("{{TOOLS}}", describeTools(tools));
    }

    private static String describeTools(List<ToolDescriptor> tools) {
        StringBuilder sb = new StringBuilder();
        for (ToolDescriptor tool : tools) {
            sb.append("- ").append(tool.name()).append(": ").append(tool.description()).append('\n');
            if (tool.inputSchema() != null) {
                try {
                    sb.append("  arguments schema: ").append(MAPPER.writeValueAsString(tool.inputSchema())).append('\n');
                } catch (IOException e) {
                    log.warn("Could not render schema for tool {}", tool.name(), e);
                }
            }
        }
        return sb.toString().stripTrailing();
    }

    static String loadTemplate() {
        try (InputStream in = SystemPromptBuilder.class.getClassLoader().getResourceAsStream(TEMPLATE_RESOURCE)) {
            if (in != null) {
                log.info("Loaded system prompt template from classpath:{}", TEMPLATE_RESOURCE);
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            log.warn("Failed to load system prompt template: {}", e.getMessage());
        }
        log.warn("Using fallback built-in system prompt template");
        return FALLBACK_TEMPLATE;
    }
}
