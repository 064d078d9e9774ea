package sqlrunner.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the SQL runner.
 * Maps to the 'runner' prefix in application.yml.
 */
@ConfigurationProperties("runner")
public class RunnerProperties {

    private HistoryConfig history = new HistoryConfig();
    private ExecutionConfig execution = new ExecutionConfig();
    private SchemaConfig schema = new SchemaConfig();
    private SqlLoggingConfig sqlLogging = new SqlLoggingConfig();
    private SecurityConfig security = new SecurityConfig();
    private BackpressureConfig backpressure = new BackpressureConfig();
    private ErrorHandlingConfig errorHandling = new ErrorHandlingConfig();
    private SampleDataConfig sampleData = new SampleDataConfig();

    public HistoryConfig getHistory() {
        return history;
    }

    public void setHistory(HistoryConfig history) {
        this.history = history;
    }

    public ExecutionConfig getExecution() {
        return execution;
    }

    public void setExecution(ExecutionConfig execution) {
        this.execution = execution;
    }

    public SchemaConfig getSchema() {
        return schema;
    }

    public void setSchema(SchemaConfig schema) {
        this.schema = schema;
    }

    public SqlLoggingConfig getSqlLogging() {
        return sqlLogging;
    }

    public void setSqlLogging(SqlLoggingConfig sqlLogging) {
        this.sqlLogging = sqlLogging;
    }

    public SecurityConfig getSecurity() {
        return security;
    }

    public void setSecurity(SecurityConfig security) {
        this.security = security;
    }

    public BackpressureConfig getBackpressure() {
        return backpressure;
    }

    public void setBackpressure(BackpressureConfig backpressure) {
        this.backpressure = backpressure;
    }

    public ErrorHandlingConfig getErrorHandling() {
        return errorHandling;
    }

    public void setErrorHandling(ErrorHandlingConfig errorHandling) {
        this.errorHandling = errorHandling;
    }

    public SampleDataConfig getSampleData() {
        return sampleData;
    }

    public void setSampleData(SampleDataConfig sampleData) {
        this.sampleData = sampleData;
    }

    /**
     * Execution history settings.
     */
    @ConfigurationProperties("history")
    public static class HistoryConfig {

        /**
         * Backing store: "memory" or "database".
         */
        @NotBlank
        private String store = "memory";

        @Positive
        private int capacity = 50;

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }

    /**
     * Statement execution settings.
     */
    @ConfigurationProperties("execution")
    public static class ExecutionConfig {

        @PositiveOrZero
        private int queryTimeoutSeconds = 30;

        /**
         * Upper bound on materialized SELECT rows. 0 disables the cap.
         */
        @PositiveOrZero
        private int maxResultRows = 10_000;

        public int getQueryTimeoutSeconds() {
            return queryTimeoutSeconds;
        }

        public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
            this.queryTimeoutSeconds = queryTimeoutSeconds;
        }

        public int getMaxResultRows() {
            return maxResultRows;
        }

        public void setMaxResultRows(int maxResultRows) {
            this.maxResultRows = maxResultRows;
        }
    }

    /**
     * Schema browsing settings.
     */
    @ConfigurationProperties("schema")
    public static class SchemaConfig {

        private List<String> excludedTables = new ArrayList<>(List.of("query_history", "users"));

        @Positive
        private int sampleRows = 5;

        public List<String> getExcludedTables() {
            return excludedTables;
        }

        public void setExcludedTables(List<String> excludedTables) {
            this.excludedTables = excludedTables;
        }

        public int getSampleRows() {
            return sampleRows;
        }

        public void setSampleRows(int sampleRows) {
            this.sampleRows = sampleRows;
        }
    }

    /**
     * SQL logging configuration properties.
     */
    @ConfigurationProperties("sql-logging")
    public static class SqlLoggingConfig {

        private boolean enabled = true;

        private boolean logParameters = true;

        @Positive
        private long slowQueryThresholdMs = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isLogParameters() {
            return logParameters;
        }

        public void setLogParameters(boolean logParameters) {
            this.logParameters = logParameters;
        }

        public long getSlowQueryThresholdMs() {
            return slowQueryThresholdMs;
        }

        public void setSlowQueryThresholdMs(long slowQueryThresholdMs) {
            this.slowQueryThresholdMs = slowQueryThresholdMs;
        }
    }

    /**
     * Bearer token settings. Each token entry has the form {@code username:token}.
     */
    @ConfigurationProperties("security")
    public static class SecurityConfig {

        private boolean enabled = true;

        private List<String> tokens = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getTokens() {
            return tokens;
        }

        public void setTokens(List<String> tokens) {
            this.tokens = tokens;
        }
    }

    /**
     * Concurrent request limiting.
     */
    @ConfigurationProperties("backpressure")
    public static class BackpressureConfig {

        private boolean enabled = true;

        @Positive
        private int maxConcurrentRequests = 64;

        @Positive
        private long requestTimeoutMs = 60_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxConcurrentRequests() {
            return maxConcurrentRequests;
        }

        public void setMaxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = maxConcurrentRequests;
        }

        public long getRequestTimeoutMs() {
            return requestTimeoutMs;
        }

        public void setRequestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
        }
    }

    /**
     * Controls what error information reaches clients.
     * Keep both flags off in production; stack traces are always logged server-side.
     */
    @ConfigurationProperties("error-handling")
    public static class ErrorHandlingConfig {

        private boolean exposeDetails = false;

        private boolean exposeStackTrace = false;

        public boolean isExposeDetails() {
            return exposeDetails;
        }

        public void setExposeDetails(boolean exposeDetails) {
            this.exposeDetails = exposeDetails;
        }

        public boolean isExposeStackTrace() {
            return exposeStackTrace;
        }

        public void setExposeStackTrace(boolean exposeStackTrace) {
            this.exposeStackTrace = exposeStackTrace;
        }
    }

    @ConfigurationProperties("sample-data")
    public static class SampleDataConfig {

        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
