package com.tool.execution.registry;

import com.tool.execution.core.error.DuplicateToolException;
import com.tool.execution.core.error.ToolNotFoundException;
import com.tool.execution.core.model.ToolDefinition;
import com.tool.execution.core.model.ToolDescriptor;
import com.tool.execution.core.model.ToolHandler;
import com.tool.execution.logging.LogContext;
import com.tool.execution.policy.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Catalog of available tools: name to descriptor and handler.
 *
 * <p>Lookups and listings never lock. Registrations are serialized so the listing keeps
 * registration order. Names are unique and tools cannot be removed once registered.</p>
 */
public class ToolRegistry {
    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolDefinition> tools = new ConcurrentHashMap<>();
    private final List<ToolDescriptor> registrationOrder = new CopyOnWriteArrayList<>();

    /**
     * Registers a tool.
     *
     * @throws DuplicateToolException   if a tool with the same name is already registered
     * @throws IllegalArgumentException if the descriptor's timeout, retry delay or cache TTL is invalid
     */
    public ToolDefinition register(ToolDescriptor descriptor, ToolHandler handler) {
        return register(new ToolDefinition(descriptor, handler));
    }

    public synchronized ToolDefinition register(ToolDefinition definition) {
        Objects.requireNonNull(definition, "definition is required");
        ToolDescriptor descriptor = definition.descriptor();
        checkConfiguration(descriptor);

        try (LogContext ctx = LogContext.forRegistration(descriptor.getName())) {
            if (tools.putIfAbsent(descriptor.getName(), definition) != null) {
                log.warn("tool.register.duplicate tool={}", descriptor.getName());
                throw new DuplicateToolException(descriptor.getName());
            }
            registrationOrder.add(descriptor);
            log.info("tool.registered tool={} version={} cacheable={}",
                    descriptor.getName(), descriptor.getVersion(), descriptor.isCacheable());
        }
        return definition;
    }

    /**
     * Looks up a tool by name.
     *
     * @throws ToolNotFoundException if no tool with that name is registered
     */
    public ToolDefinition lookup(String name) {
        return find(name).orElseThrow(() -> new ToolNotFoundException(name));
    }

    public Optional<ToolDefinition> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    public int size() {
        return tools.size();
    }

    /**
     * Descriptors of every registered tool, in registration order.
     */
    public List<ToolDescriptor> list() {
        return List.copyOf(registrationOrder);
    }

    private static void checkConfiguration(ToolDescriptor descriptor) {
        descriptor.getTimeout().ifPresent(timeout -> {
            if (timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException(
                        "Tool '" + descriptor.getName() + "': timeout must be > 0, got " + timeout);
            }
            requireSchedulable(descriptor, "timeout", timeout);
        });
        descriptor.getRetryDelay().ifPresent(delay -> requireNonNegative(descriptor, "retryDelay", delay));
        descriptor.getCacheTtl().ifPresent(ttl -> requireNonNegative(descriptor, "cacheTtl", ttl));
    }

    private static void requireNonNegative(ToolDescriptor descriptor, String field, Duration value) {
        if (value.isNegative()) {
            throw new IllegalArgumentException(
                    "Tool '" + descriptor.getName() + "': " + field + " must be >= 0, got " + value);
        }
        requireSchedulable(descriptor, field, value);
    }

    private static void requireSchedulable(ToolDescriptor descriptor, String field, Duration value) {
        if (value.compareTo(RetryPolicy.MAX_DURATION) > 0) {
            throw new IllegalArgumentException("Tool '" + descriptor.getName() + "': " + field
                    + " must be <= " + RetryPolicy.MAX_DURATION + ", got " + value);
        }
    }
}
