package io.github.hatchcrm.aiemployees.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.github.hatchcrm.aiemployees.protocol.api.ToolDescriptor;
import io.github.hatchcrm.aiemployees.runtime.error.ToolExecutionException;
import io.github.hatchcrm.aiemployees.runtime.error.ToolValidationException;
import io.github.hatchcrm.aiemployees.runtime.error.UnknownToolException;
import io.github.hatchcrm.aiemployees.runtime.support.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Catalog of callable tools keyed by {@link Tool#key()}. Dispatch only: approval and
 * autonomy decisions are made by the caller, so in-process callers may use
 * {@link #execute} directly for pure reads.
 */
@Component
public class ToolRegistry implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final Map<String, JsonSchema> schemas = new ConcurrentHashMap<>();
    private final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private final ApplicationContext applicationContext;
    private final TimeLimiter timeLimiter;
    private final Duration defaultTimeout;

    public ToolRegistry(ApplicationContext applicationContext, TimeLimiter timeLimiter,
                        @Value("${hatch.ai.tool-timeout:30s}") Duration defaultTimeout) {
        this.applicationContext = applicationContext;
        this.timeLimiter = timeLimiter;
        this.defaultTimeout = defaultTimeout;
    }

    // Delegation tools need services that themselves depend on this registry, so SPI
    // loading waits until every singleton exists.
    @Override
    public void afterSingletonsInstantiated() {
        loadTools();
    }

    public void loadTools() {
        ServiceLoader<Tool> loader = ServiceLoader.load(Tool.class);
        for (Tool tool : loader) {
            injectDependencies(tool);
            register(tool);
        }
        log.info("Loaded {} tools via SPI", tools.size());
    }

    public void register(Tool tool) {
        Tool previous = tools.put(tool.key(), tool);
        schemas.remove(tool.key());
        if (previous != null && previous != tool) {
            log.warn("Tool '{}' re-registered: {} replaced by {}", tool.key(),
                    previous.getClass().getSimpleName(), tool.getClass().getSimpleName());
        } else {
            log.debug("Registered tool: {}", tool.key());
        }
    }

    public Optional<Tool> get(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(tools.get(key));
    }

    public Collection<Tool> all() {
        return Collections.unmodifiableCollection(tools.values());
    }

    public List<ToolDescriptor> descriptors() {
        return tools.values().stream()
                .sorted(Comparator.comparing(Tool::key))
                .map(t -> new ToolDescriptor(t.key(), t.description(), t.allowAutoRun(),
                        t.defaultRequiresApproval(), t.inputSchema()))
                .toList();
    }

    /**
     * Validates {@code input} against the tool's schema and runs the handler within the tool's
     * timeout.
     *
     * @throws UnknownToolException    no tool is registered under {@code key}
     * @throws ToolValidationException the input does not satisfy the schema
     * @throws ToolExecutionException  the handler failed, threw, or timed out
     */
    public JsonNode execute(String key, JsonNode input, ToolContext context) {
        Tool tool = get(key).orElseThrow(() -> new UnknownToolException(key));
        JsonNode args = input == null || input.isNull() ? MAPPER.createObjectNode() : input;
        validate(tool, args);

        Duration timeout = tool.timeout() != null ? tool.timeout() : defaultTimeout;
        ToolResult result;
        try {
            result = timeLimiter.call(() -> tool.execute(context, args), timeout);
        } catch (TimeoutException e) {
            throw new ToolExecutionException(key,
                    "Tool '" + key + "' timed out after " + timeout.toMillis() + " ms", e);
        } catch (ToolExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new ToolExecutionException(key, message, e);
        }

        if (result == null) {
            throw new ToolExecutionException(key, "Tool '" + key + "' returned no result");
        }
        if (!result.success()) {
            throw new ToolExecutionException(key, result.error() != null ? result.error() : "Tool '" + key + "' failed");
        }
        return result.output();
    }

    private void validate(Tool tool, JsonNode args) {
        JsonNode schemaNode = tool.inputSchema();
        if (schemaNode == null) return;
        JsonSchema schema = schemas.computeIfAbsent(tool.key(), k -> schemaFactory.getSchema(schemaNode));
        Set<ValidationMessage> messages = schema.validate(args);
        if (!messages.isEmpty()) {
            List<String> errors = messages.stream().map(ValidationMessage::getMessage).sorted().toList();
            throw new ToolValidationException(tool.key(), errors);
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
