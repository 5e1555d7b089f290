package io.github.drompincen.pocpilot.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Process-level assistant settings, bound once at startup from {@code pocpilot.assistant.*}.
 */
@ConfigurationProperties(prefix = "pocpilot.assistant")
public class AssistantProperties {

    /** Sessions idle for longer than this are expired by the sweep. */
    private Duration idleTimeout = Duration.ofMinutes(10);

    /** Tool-call rounds allowed inside one turn before it is aborted. */
    private int maxToolRounds = 4;

    /** Most recent messages sent to the model as history; 0 sends all of them. */
    private int contextWindow = 20;

    private int maxMessagesPerSession = 200;
    private int maxMessageLength = 4000;

    /** Replace answers that were produced without a successful tool call. */
    private boolean requireToolGrounding = true;

    /** Allow-listed tool names. Unknown names are ignored. */
    private List<String> tools = new ArrayList<>(List.of(
            "list_my_active_pocs", "list_poc_tasks", "list_eligible_users", "get_poc_summary"));

    private int tenantConcurrentTurns = 4;
    private Duration admissionWait = Duration.ofSeconds(2);

    private Upstream upstream = new Upstream();

    public static class Upstream {
        private String baseUrl = "http://localhost:11434";
        private String model = "llama3.2";
        private double temperature = 0.2;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(120);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    }

    public Duration getIdleTimeout() { return idleTimeout; }
    public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }

    public int getMaxToolRounds() { return maxToolRounds; }
    public void setMaxToolRounds(int maxToolRounds) { this.maxToolRounds = maxToolRounds; }

    public int getContextWindow() { return contextWindow; }
    public void setContextWindow(int contextWindow) { this.contextWindow = contextWindow; }

    public int getMaxMessagesPerSession() { return maxMessagesPerSession; }
    public void setMaxMessagesPerSession(int maxMessagesPerSession) { this.maxMessagesPerSession = maxMessagesPerSession; }

    public int getMaxMessageLength() { return maxMessageLength; }
    public void setMaxMessageLength(int maxMessageLength) { this.maxMessageLength = maxMessageLength; }

    public boolean isRequireToolGrounding() { return requireToolGrounding; }
    public void setRequireToolGrounding(boolean requireToolGrounding) { this.requireToolGrounding = requireToolGrounding; }

    public List<String> getTools() { return tools; }
    public void setTools(List<String> tools) { this.tools = tools; }

    public int getTenantConcurrentTurns() { return tenantConcurrentTurns; }
    public void setTenantConcurrentTurns(int tenantConcurrentTurns) { this.tenantConcurrentTurns = tenantConcurrentTurns; }

    public Duration getAdmissionWait() { return admissionWait; }
    public void setAdmissionWait(Duration admissionWait) { this.admissionWait = admissionWait; }

    public Upstream getUpstream() { return upstream; }
    public void setUpstream(Upstream upstream) { this.upstream = upstream; }
}
