package com.fleetmind;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "fleetmind")
public class FleetmindProperties {

    private Worker worker = new Worker();
    private Pipeline pipeline = new Pipeline();
    private Persistence persistence = new Persistence();

    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }
    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }
    public Persistence getPersistence() { return persistence; }
    public void setPersistence(Persistence persistence) { this.persistence = persistence; }

    public static class Worker {
        /** Explicit path to the worker executable; blank means discover it. */
        private String executable = "";
        /** Model passed with --model when a spawn request names none. */
        private String defaultModel = "";
        /** "blocked" strips the provider API key from the child environment. */
        private String apiKeyMode = "";
        private int recentOutputLimit = 500;
        private int retainedEndedWorkers = 100;
        private int settleTimeoutSeconds = 1800;
        private long stopGraceMillis = 2000;

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
        public String getApiKeyMode() { return apiKeyMode; }
        public void setApiKeyMode(String apiKeyMode) { this.apiKeyMode = apiKeyMode; }
        public int getRecentOutputLimit() { return recentOutputLimit; }
        public void setRecentOutputLimit(int recentOutputLimit) { this.recentOutputLimit = recentOutputLimit; }
        public int getRetainedEndedWorkers() { return retainedEndedWorkers; }
        public void setRetainedEndedWorkers(int retainedEndedWorkers) { this.retainedEndedWorkers = retainedEndedWorkers; }
        public int getSettleTimeoutSeconds() { return settleTimeoutSeconds; }
        public void setSettleTimeoutSeconds(int settleTimeoutSeconds) { this.settleTimeoutSeconds = settleTimeoutSeconds; }
        public long getStopGraceMillis() { return stopGraceMillis; }
        public void setStopGraceMillis(long stopGraceMillis) { this.stopGraceMillis = stopGraceMillis; }
    }

    public static class Pipeline {
        private int maxIterations = 5;
        private int orchestratorThreads = 4;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public int getOrchestratorThreads() { return orchestratorThreads; }
        public void setOrchestratorThreads(int orchestratorThreads) { this.orchestratorThreads = orchestratorThreads; }
    }

    public static class Persistence {
        /** JDBC URL of the run store; blank keeps run history in memory. */
        private String url = "";
        private String username = "";
        private String password = "";
        private int queueCapacity = 10_000;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }
}
