package io.github.drompincen.tablecopilot.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.github.drompincen.tablecopilot.protocol.api.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.lang.reflect.Method;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Name-keyed set of tools. Tools are discovered through {@link ServiceLoader}
 * at startup and receive Spring beans through their single-argument setters.
 * {@link #invoke} checks arguments against the tool's input schema before
 * dispatching and never retries.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final Map<String, JsonSchema> schemas = new ConcurrentHashMap<>();
    private final ApplicationContext applicationContext;

    public ToolRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @PostConstruct
    public void loadTools() {
        ServiceLoader<Tool> loader = ServiceLoader.load(Tool.class, getClass().getClassLoader());
        for (Tool tool : loader) {
            injectDependencies(tool);
            register(tool);
        }
        log.info("Loaded {} tools via SPI: {}", tools.size(), new TreeSet<>(tools.keySet()));
    }

    public void register(Tool tool) {
        if (tools.putIfAbsent(tool.name(), tool) != null) {
            throw new DuplicateToolException(tool.name());
        }
        if (tool.inputSchema() != null) {
            schemas.put(tool.name(), SCHEMA_FACTORY.getSchema(tool.inputSchema()));
        }
        log.debug("Registered tool: {}", tool.name());
    }

    public Optional<Tool> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> all() {
        return Collections.unmodifiableCollection(tools.values());
    }

    public List<ToolDescriptor> descriptors() {
        return tools.values().stream()
                .sorted(Comparator.comparing(Tool::name))
                .map(t -> new ToolDescriptor(t.name(), t.description(),
                        t.inputSchema(), t.outputSchema(), t.terminal()))
                .collect(Collectors.toList());
    }

    /**
     * @throws UnknownToolException      if no tool has this name
     * @throws InvalidArgumentsException if the arguments fail the input schema
     * @throws ToolExecutionException    if the tool itself throws
     */
    public ToolResult invoke(String name, JsonNode arguments, ToolContext ctx) {
        Tool tool = tools.get(name);
        if (tool == null) {
            throw new UnknownToolException(name);
        }
        JsonNode args = arguments == null || arguments.isMissingNode() || arguments.isNull()
                ? JsonNodeFactory.instance.objectNode()
                : arguments;

        JsonSchema schema = schemas.get(name);
        if (schema != null) {
            Set<ValidationMessage> errors = schema.validate(args);
            if (!errors.isEmpty()) {
                throw new InvalidArgumentsException(name, errors.stream()
                        .map(ValidationMessage::getMessage)
                        .sorted()
                        .collect(Collectors.toList()));
            }
        }

        try {
            return tool.execute(ctx, args);
        } catch (RuntimeException e) {
            throw new ToolExecutionException(name, e);
        }
    }

    private void injectDependencies(Tool tool) {
        for (Method method : tool.getClass().getMethods()) {
            if (method.getName().startsWith("set") && method.getParameterCount() == 1) {
                Class<?> paramType = method.getParameterTypes()[0];
                try {
                    Object bean = applicationContext.getBean(paramType);
                    method.invoke(tool, bean);
                    log.debug("Injected {} into {}.{}", paramType.getSimpleName(),
                            tool.getClass().getSimpleName(), method.getName());
                } catch (NoSuchBeanDefinitionException e) {
                    log.trace("No bean of type {} for {}.{}", paramType.getSimpleName(),
                            tool.getClass().getSimpleName(), method.getName());
                } catch (Exception e) {
                    log.warn("Failed to inject {} into {}.{}: {}", paramType.getSimpleName(),
                            tool.getClass().getSimpleName(), method.getName(), e.getMessage());
                }
            }
        }
    }
}
