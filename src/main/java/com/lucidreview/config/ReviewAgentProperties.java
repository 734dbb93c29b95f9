package com.lucidreview.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "reviewagent")
public class ReviewAgentProperties {

    private String modelId;
    private int maxTurns = 30;
    private int maxTokens = 4096;
    private double temperature = 0.1;
    private String determinationTool = "propose_determination";
    private AiProvider aiProvider = AiProvider.OPENAI;
    private QueueConfig queue = new QueueConfig();
    private ToolServerConfig tools = new ToolServerConfig();

    public enum AiProvider {
        GOOGLE("gemini-2.5-flash"),
        OPENAI("gpt-4o");

        private final String defaultModel;

        AiProvider(String defaultModel) {
            this.defaultModel = defaultModel;
        }

        public String getDefaultModel() {
            return defaultModel;
        }
    }

    public enum QueueBackend {
        REDIS, MEMORY
    }

    /**
     * Durable work queue settings. Attempts and backoff apply to queue-level failures only;
     * a run that fails inside the run loop is already terminal and is never retried.
     */
    public static class QueueConfig {
        private QueueBackend backend = QueueBackend.REDIS;
        private String name = "agent-review";
        private int concurrency = 3;
        private int attempts = 2;
        private Duration backoff = Duration.ofSeconds(5);
        private int removeOnComplete = 100;
        private int removeOnFail = 200;
        private Duration pollInterval = Duration.ofMillis(500);
        private Duration lockDuration = Duration.ofSeconds(30);
        private boolean workerEnabled = true;

        public QueueBackend getBackend() { return backend; }
        public void setBackend(QueueBackend backend) { this.backend = backend != null ? backend : QueueBackend.REDIS; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); }
        public int getAttempts() { return attempts; }
        public void setAttempts(int attempts) { this.attempts = Math.max(1, attempts); }
        public Duration getBackoff() { return backoff; }
        public void setBackoff(Duration backoff) { this.backoff = backoff; }
        public int getRemoveOnComplete() { return removeOnComplete; }
        public void setRemoveOnComplete(int removeOnComplete) { this.removeOnComplete = removeOnComplete; }
        public int getRemoveOnFail() { return removeOnFail; }
        public void setRemoveOnFail(int removeOnFail) { this.removeOnFail = removeOnFail; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getLockDuration() { return lockDuration; }
        public void setLockDuration(Duration lockDuration) { this.lockDuration = lockDuration; }
        public boolean isWorkerEnabled() { return workerEnabled; }
        public void setWorkerEnabled(boolean workerEnabled) { this.workerEnabled = workerEnabled; }
    }

    /**
     * How the worker launches the MCP tool server for each job.
     */
    public static class ToolServerConfig {
        private String command = "node";
        private List<String> args = new ArrayList<>();
        private Map<String, String> env = new HashMap<>();
        private Duration requestTimeout = Duration.ofSeconds(120);
        private int callAttempts = 1;

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public List<String> getArgs() { return args; }
        public void setArgs(List<String> args) { this.args = args != null ? new ArrayList<>(args) : new ArrayList<>(); }
        public Map<String, String> getEnv() { return env; }
        public void setEnv(Map<String, String> env) { this.env = env != null ? new HashMap<>(env) : new HashMap<>(); }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
        public int getCallAttempts() { return callAttempts; }
        public void setCallAttempts(int callAttempts) { this.callAttempts = Math.max(1, callAttempts); }
    }

    /**
     * The configured model id, or the selected provider's default model when none is set.
     */
    public String getModelId() {
        return StringUtils.hasText(modelId) ? modelId : aiProvider.getDefaultModel();
    }

    public void setModelId(String modelId) {
        this.modelId = modelId;
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    public void setMaxTurns(int maxTurns) {
        this.maxTurns = maxTurns;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public String getDeterminationTool() {
        return determinationTool;
    }

    public void setDeterminationTool(String determinationTool) {
        this.determinationTool = determinationTool;
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider != null ? aiProvider : AiProvider.OPENAI;
    }

    public QueueConfig getQueue() {
        return queue;
    }

    public void setQueue(QueueConfig queue) {
        this.queue = queue != null ? queue : new QueueConfig();
    }

    public ToolServerConfig getTools() {
        return tools;
    }

    public void setTools(ToolServerConfig tools) {
        this.tools = tools != null ? tools : new ToolServerConfig();
    }
}
