package sqlrunner.interceptor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.inject.Singleton;
import org.apache.ibatis.executor.Executor;
import org.apache.ibatis.mapping.BoundSql;
import org.apache.ibatis.mapping.MappedStatement;
import org.apache.ibatis.mapping.ParameterMapping;
import org.apache.ibatis.plugin.Interceptor;
import org.apache.ibatis.plugin.Intercepts;
import org.apache.ibatis.plugin.Invocation;
import org.apache.ibatis.plugin.Plugin;
import org.apache.ibatis.plugin.Signature;
import org.apache.ibatis.reflection.MetaObject;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.ResultHandler;
import org.apache.ibatis.session.RowBounds;
import org.apache.ibatis.type.TypeHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlrunner.config.RunnerProperties;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

/**
 * MyBatis interceptor that traces history-ledger SQL to the SQL_LOGGER category
 * and records timing metrics.
 */
@Singleton
@Intercepts({
        @Signature(type = Executor.class, method = "update",
                args = {MappedStatement.class, Object.class}),
        @Signature(type = Executor.class, method = "query",
                args = {MappedStatement.class, Object.class, RowBounds.class, ResultHandler.class})
})
public class SqlLoggingInterceptor implements Interceptor {

    private static final Logger LOG = LoggerFactory.getLogger(SqlLoggingInterceptor.class);
    private static final Logger SQL_LOG = LoggerFactory.getLogger("SQL_LOGGER");
    private static final int MAX_STRING_PARAM = 100;

    private final RunnerProperties.SqlLoggingConfig config;
    private final MeterRegistry meterRegistry;

    public SqlLoggingInterceptor(RunnerProperties properties, MeterRegistry meterRegistry) {
        this.config = properties.getSqlLogging();
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Object intercept(Invocation invocation) throws Throwable {
        if (!config.isEnabled()) {
            return invocation.proceed();
        }

        MappedStatement mappedStatement = (MappedStatement) invocation.getArgs()[0];
        Object parameter = invocation.getArgs().length > 1 ? invocation.getArgs()[1] : null;

        String statementId = shortId(mappedStatement.getId());
        BoundSql boundSql = mappedStatement.getBoundSql(parameter);
        String sql = normalizeSql(boundSql.getSql());
        String params = config.isLogParameters()
                ? extractParameters(mappedStatement.getConfiguration(), boundSql)
                : "";

        long startTime = System.currentTimeMillis();
        try {
            Object result = invocation.proceed();
            logExecution(statementId, sql, params, System.currentTimeMillis() - startTime, null, describeResult(result));
            return result;
        } catch (Throwable e) {
            logExecution(statementId, sql, params, System.currentTimeMillis() - startTime, e, null);
            throw e;
        }
    }

    private void logExecution(String statementId, String sql, String params,
                              long duration, Throwable error, String resultInfo) {
        boolean slow = duration >= config.getSlowQueryThresholdMs();

        StringBuilder message = new StringBuilder()
                .append(statementId).append(" | ").append(sql)
                .append(" | params=").append(params.isEmpty() ? "(none)" : params)
                .append(" | ").append(duration).append(" ms");
        if (slow) {
            message.append(" [SLOW]");
        }
        if (resultInfo != null) {
            message.append(" | ").append(resultInfo);
        }

        if (error != null) {
            SQL_LOG.error("{} | error={}", message, error.getMessage());
        } else if (slow) {
            SQL_LOG.warn(message.toString());
        } else if (SQL_LOG.isDebugEnabled()) {
            SQL_LOG.debug(message.toString());
        }

        recordMetrics(statementId, duration, slow, error != null);
    }

    private void recordMetrics(String statementId, long duration, boolean slow, boolean failed) {
        Timer.builder("runner.history.sql.duration")
                .tag("statement", statementId)
                .tag("slow", String.valueOf(slow))
                .tag("error", String.valueOf(failed))
                .register(meterRegistry)
                .record(Duration.ofMillis(duration));

        if (failed) {
            meterRegistry.counter("runner.history.sql.errors", "statement", statementId).increment();
        }
    }

    private String extractParameters(Configuration configuration, BoundSql boundSql) {
        Object parameterObject = boundSql.getParameterObject();
        List<ParameterMapping> mappings = boundSql.getParameterMappings();
        if (mappings.isEmpty() || parameterObject == null) {
            return "";
        }

        StringBuilder sb = new StringBuilder("[");
        TypeHandlerRegistry typeHandlers = configuration.getTypeHandlerRegistry();
        try {
            if (typeHandlers.hasTypeHandler(parameterObject.getClass())) {
                sb.append(formatValue(parameterObject));
            } else {
                MetaObject metaObject = configuration.newMetaObject(parameterObject);
                for (int i = 0; i < mappings.size(); i++) {
                    String property = mappings.get(i).getProperty();
                    Object value = boundSql.hasAdditionalParameter(property)
                            ? boundSql.getAdditionalParameter(property)
                            : metaObject.getValue(property);
                    if (i > 0) {
                        sb.append(", ");
                    }
                    sb.append(property).append('=').append(formatValue(value));
                }
            }
        } catch (RuntimeException e) {
            LOG.warn("Failed to extract parameters: {}", e.getMessage());
            return "[extraction failed]";
        }
        return sb.append(']').toString();
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String str) {
            return str.length() > MAX_STRING_PARAM
                    ? "'" + str.substring(0, MAX_STRING_PARAM) + "...[truncated]'"
                    : "'" + str + "'";
        }
        return value.toString();
    }

    static String normalizeSql(String sql) {
        return sql.replaceAll("\\s+", " ").trim();
    }

    // HistoryMapper.insert rather than the fully qualified id
    static String shortId(String id) {
        int lastDot = id.lastIndexOf('.');
        int previousDot = lastDot > 0 ? id.lastIndexOf('.', lastDot - 1) : -1;
        return previousDot >= 0 ? id.substring(previousDot + 1) : id;
    }

    private static String describeResult(Object result) {
        if (result instanceof List<?> list) {
            return list.size() + " rows";
        }
        if (result instanceof Integer count) {
            return count + " rows affected";
        }
        return result == null ? "null" : result.getClass().getSimpleName();
    }

    @Override
    public Object plugin(Object target) {
        return Plugin.wrap(target, this);
    }

    @Override
    public void setProperties(Properties properties) {
        // configured through RunnerProperties
    }
}
