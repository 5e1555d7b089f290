package io.github.drompincen.pocpilot.runtime.tools;

import io.github.drompincen.pocpilot.protocol.api.ToolRiskProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.lang.reflect.Method;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final ApplicationContext applicationContext;

    public ToolRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @PostConstruct
    public void loadTools() {
        ServiceLoader<Tool> loader = ServiceLoader.load(Tool.class);
        for (Tool tool : loader) {
            injectDependencies(tool);
            try {
                register(tool);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping tool {}: {}", tool.getClass().getName(), e.getMessage());
            }
        }
        log.info("Loaded {} tools via SPI", tools.size());
    }

    /**
     * Only read-only tools from {@link AssistantTool} are accepted; the assistant has no tool
     * that changes domain state.
     */
    public void register(Tool tool) {
        if (AssistantTool.fromName(tool.name()).isEmpty()) {
            throw new IllegalArgumentException("Unknown assistant tool: " + tool.name());
        }
        Set<ToolRiskProfile> profiles = tool.riskProfiles();
        if (profiles == null || !profiles.equals(Set.of(ToolRiskProfile.READ_ONLY))) {
            throw new IllegalArgumentException("Tool " + tool.name() + " is not read-only: " + profiles);
        }
        tools.put(tool.name(), tool);
        log.debug("Registered tool: {}", tool.name());
    }

    public Optional<Tool> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> all() {
        return Collections.unmodifiableCollection(tools.values());
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
