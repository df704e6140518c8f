package com.project.items.persistence;

import com.project.items.config.AppSettings;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Connection pool for the item store.
 *
 * <p>Sizing is fixed at startup: {@code DB_POOL_SIZE} connections are kept idle and up to
 * {@code DB_MAX_OVERFLOW} more are opened under load. Callers beyond that wait at most
 * {@code DB_POOL_TIMEOUT_MS}. Hikari checks each connection with JDBC4 {@code isValid}
 * before handing it out and replaces dead ones.
 */
@Configuration
public class PersistenceConfig {
    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(AppSettings settings) {
        // pool starts on first checkout, after Micrometer has bound its metrics tracker
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setJdbcUrl(settings.database().jdbcUrl());
        if (settings.database().username() != null) {
            dataSource.setUsername(settings.database().username());
        }
        if (settings.database().password() != null) {
            dataSource.setPassword(settings.database().password());
        }
        dataSource.setPoolName("ItemPool");
        dataSource.setMinimumIdle(settings.poolSize());
        dataSource.setMaximumPoolSize(settings.maxPoolSize());
        dataSource.setConnectionTimeout(settings.poolTimeout().toMillis());
        dataSource.setValidationTimeout(Math.min(3000, settings.poolTimeout().toMillis()));

        log.info("Configured pool for {} (baseline: {}, overflow: {}, wait: {}ms)",
                settings.database().displayLocation(), settings.poolSize(), settings.maxOverflow(),
                settings.poolTimeout().toMillis());
        return dataSource;
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
