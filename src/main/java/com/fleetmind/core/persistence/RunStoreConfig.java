package com.fleetmind.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetmind.FleetmindProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Spring {@link Configuration} that provides the {@link RunStore} bean.
 * <p>
 * When {@code fleetmind.persistence.url} is set, a {@link JdbcRunStore} is created
 * on a pooled {@link DataSource} for that URL. Otherwise an in-memory
 * {@link InMemoryRunStore} is used as a fallback; history does not survive a restart.
 */
@Configuration
public class RunStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(RunStoreConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "fleetmind.persistence", name = "url")
    public DataSource runStoreDataSource(FleetmindProperties properties) {
        var persistence = properties.getPersistence();
        return DataSourceBuilder.create()
                .url(persistence.getUrl())
                .username(persistence.getUsername())
                .password(persistence.getPassword())
                .build();
    }

    /**
     * JDBC-backed run store, activated when a run store URL is configured.
     * Creates the required tables on startup.
     */
    @Bean
    @Primary
    @ConditionalOnProperty(prefix = "fleetmind.persistence", name = "url")
    public RunStore jdbcRunStore(DataSource runStoreDataSource, ObjectMapper objectMapper) throws Exception {
        log.info("Configuring JDBC run store");
        var store = new JdbcRunStore(runStoreDataSource, objectMapper);
        store.createTables();
        return store;
    }

    /**
     * In-memory fallback run store, used when no database is configured.
     */
    @Bean
    @ConditionalOnMissingBean(RunStore.class)
    public RunStore inMemoryRunStore() {
        log.info("No run store URL configured; using in-memory run store (history will not persist across restarts)");
        return new InMemoryRunStore();
    }
}
