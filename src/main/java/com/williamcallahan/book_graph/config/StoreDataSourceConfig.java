package com.williamcallahan.book_graph.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Process-wide connection pools for the three stores, each with its own
 * {@link JdbcTemplate} and {@link TransactionTemplate}. No transaction manager spans stores.
 *
 * Pools start without probing the database; a store that is not up yet fails the
 * individual call instead of the application context.
 */
@Configuration
public class StoreDataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreDataSourceConfig.class);

    // ---- store A: authors (Postgres) ----

    @Bean(destroyMethod = "close")
    @Primary
    public DataSource authorsDataSource(AppConfigurationProperties properties) {
        return relationalPool("authors-pool", properties.getStores().getAuthors());
    }

    @Bean
    @Primary
    public JdbcTemplate authorsJdbcTemplate(@Qualifier("authorsDataSource") DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    @Primary
    public DataSourceTransactionManager authorsTransactionManager(@Qualifier("authorsDataSource") DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate authorsTransactionTemplate(@Qualifier("authorsTransactionManager") DataSourceTransactionManager manager) {
        return new TransactionTemplate(manager);
    }

    // ---- store B: books (MariaDB) ----

    @Bean(destroyMethod = "close")
    public DataSource booksDataSource(AppConfigurationProperties properties) {
        return relationalPool("books-pool", properties.getStores().getBooks());
    }

    @Bean
    public JdbcTemplate booksJdbcTemplate(@Qualifier("booksDataSource") DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public DataSourceTransactionManager booksTransactionManager(@Qualifier("booksDataSource") DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate booksTransactionTemplate(@Qualifier("booksTransactionManager") DataSourceTransactionManager manager) {
        return new TransactionTemplate(manager);
    }

    // ---- store C: reviews (SQLite, single connection) ----

    @Bean(destroyMethod = "close")
    public DataSource reviewsDataSource(AppConfigurationProperties properties) {
        AppConfigurationProperties.EmbeddedStore store = properties.getStores().getReviews();
        Path file = Path.of(store.getPath()).toAbsolutePath().normalize();
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot create directory for review store " + file, ex);
        }

        HikariConfig config = new HikariConfig();
        config.setPoolName("reviews-pool");
        config.setJdbcUrl("jdbc:sqlite:" + file);
        config.setDriverClassName("org.sqlite.JDBC");
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(1);
        config.setInitializationFailTimeout(-1);
        config.addDataSourceProperty("busy_timeout", String.valueOf(store.getBusyTimeoutMs()));
        log.info("Review store at {}", file);
        return new HikariDataSource(config);
    }

    @Bean
    public JdbcTemplate reviewsJdbcTemplate(@Qualifier("reviewsDataSource") DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public DataSourceTransactionManager reviewsTransactionManager(@Qualifier("reviewsDataSource") DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate reviewsTransactionTemplate(@Qualifier("reviewsTransactionManager") DataSourceTransactionManager manager) {
        return new TransactionTemplate(manager);
    }

    private static HikariDataSource relationalPool(String poolName, AppConfigurationProperties.RelationalStore store) {
        HikariConfig config = new HikariConfig();
        config.setPoolName(poolName);
        config.setJdbcUrl(store.getUrl());
        if (store.getDriverClassName() != null) {
            config.setDriverClassName(store.getDriverClassName());
        }
        config.setUsername(store.getUsername());
        config.setPassword(store.getPassword());
        config.setMaximumPoolSize(store.getMaximumPoolSize());
        config.setConnectionTimeout(store.getConnectionTimeoutMs());
        config.setInitializationFailTimeout(-1);
        log.info("Configured {} for {}", poolName, store.getUrl() == null ? null : store.getUrl().replaceAll("://[^@]+@", "://***:***@"));
        return new HikariDataSource(config);
    }
}
