package sqlrunner.config;

import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.apache.ibatis.mapping.Environment;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;
import org.apache.ibatis.transaction.TransactionFactory;
import org.apache.ibatis.transaction.jdbc.JdbcTransactionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlrunner.history.HistoryMapper;
import sqlrunner.interceptor.SqlLoggingInterceptor;

import javax.sql.DataSource;

/**
 * Builds the MyBatis SqlSessionFactory used by the database-backed history ledger.
 * Only created when history is persisted to the database.
 */
@Factory
@Requires(property = "runner.history.store", value = "database")
public class MyBatisFactory {

    private static final Logger LOG = LoggerFactory.getLogger(MyBatisFactory.class);

    private final RunnerProperties runnerProperties;
    private final DataSource dataSource;
    private final SqlLoggingInterceptor sqlLoggingInterceptor;

    public MyBatisFactory(
            RunnerProperties runnerProperties,
            @Named("default") DataSource dataSource,
            SqlLoggingInterceptor sqlLoggingInterceptor) {
        this.runnerProperties = runnerProperties;
        this.dataSource = dataSource;
        this.sqlLoggingInterceptor = sqlLoggingInterceptor;
    }

    @Singleton
    public SqlSessionFactory sqlSessionFactory() {
        LOG.info("Creating SqlSessionFactory for history persistence");

        TransactionFactory transactionFactory = new JdbcTransactionFactory();
        Environment environment = new Environment("history", transactionFactory, dataSource);

        Configuration configuration = new Configuration(environment);
        configuration.setCacheEnabled(false);
        configuration.setDefaultStatementTimeout(runnerProperties.getExecution().getQueryTimeoutSeconds());
        configuration.setMapUnderscoreToCamelCase(true);

        if (runnerProperties.getSqlLogging().isEnabled()) {
            configuration.addInterceptor(sqlLoggingInterceptor);
            LOG.debug("SQL logging interceptor added");
        }

        configuration.addMapper(HistoryMapper.class);

        SqlSessionFactory factory = new SqlSessionFactoryBuilder().build(configuration);
        LOG.info("SqlSessionFactory created with {} mapped statements", configuration.getMappedStatementNames().size());
        return factory;
    }
}
