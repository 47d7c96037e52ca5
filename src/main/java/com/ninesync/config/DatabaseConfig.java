package com.ninesync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.io.File;

/**
 * Local store initialization: data directory and schema
 */
@Slf4j
@Configuration
public class DatabaseConfig {

    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    @Bean
    public DataSourceInitializer dataSourceInitializer(DataSource dataSource,
                                                       @Value("${spring.datasource.url}") String url) {
        File parent = databaseDirectory(url);
        if (parent != null && parent.mkdirs()) {
            log.info("Created data directory {}", parent.getAbsolutePath());
        }

        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(dataSource);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.addScript(new ClassPathResource("schema.sql"));
        populator.setContinueOnError(true);
        initializer.setDatabasePopulator(populator);

        return initializer;
    }

    /**
     * Directory of a file based SQLite URL, null for in-memory databases
     */
    static File databaseDirectory(String url) {
        if (url == null || !url.startsWith(SQLITE_PREFIX)) {
            return null;
        }
        String path = url.substring(SQLITE_PREFIX.length());
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (path.isEmpty() || path.startsWith(":memory:") || path.startsWith("file::memory:")) {
            return null;
        }
        return new File(path).getAbsoluteFile().getParentFile();
    }
}
