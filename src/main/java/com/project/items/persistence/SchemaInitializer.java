package com.project.items.persistence;

import com.project.items.config.AppSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Creates the items table before the web server starts accepting requests.
 * The script only creates what is missing; existing rows are never touched.
 */
@Component
public class SchemaInitializer implements InitializingBean {
    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final AppSettings settings;

    public SchemaInitializer(DataSource dataSource, JdbcTemplate jdbcTemplate, AppSettings settings) {
        this.dataSource = dataSource;
        this.jdbcTemplate = jdbcTemplate;
        this.settings = settings;
    }

    @Override
    public void afterPropertiesSet() {
        new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);
        log.info("Items schema is in place");

        if (settings.seedSampleData()) {
            seedSampleData();
        }
    }

    private void seedSampleData() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM items", Integer.class);
        if (count != null && count > 0) {
            log.info("Skipping sample data, items table already holds {} rows", count);
            return;
        }
        new ResourceDatabasePopulator(new ClassPathResource("db/sample-data.sql")).execute(dataSource);
        log.info("Inserted sample items");
    }
}
