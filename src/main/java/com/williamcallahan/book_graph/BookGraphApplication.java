/**
 * Main application class for Book Graph
 *
 * @author William Callahan
 *
 * Features:
 * - Serves one query and mutation surface over three independently owned stores
 * - Excludes the single-datasource auto-configurations; each store wires its own
 * - Loads a local .env file before the context starts
 * - Seeds the stores on demand with --seed [--seed.dir=path]
 */

package com.williamcallahan.book_graph;

import com.williamcallahan.book_graph.config.AppConfigurationProperties;
import com.williamcallahan.book_graph.seed.SeedService;
import com.williamcallahan.book_graph.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.retry.annotation.EnableRetry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;

@SpringBootApplication(exclude = {
    DataSourceAutoConfiguration.class,
    DataSourceTransactionManagerAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class,
    // Disable SQL initialization to prevent automatic schema.sql execution
    SqlInitializationAutoConfiguration.class
})
@EnableRetry
public class BookGraphApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BookGraphApplication.class);

    private final SeedService seedService;
    private final AppConfigurationProperties properties;

    public BookGraphApplication(SeedService seedService, AppConfigurationProperties properties) {
        this.seedService = seedService;
        this.properties = properties;
    }

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile();
        SpringApplication.run(BookGraphApplication.class, args);
    }

    private static void loadDotEnvFile() {
        Path envFile = Paths.get(".env");
        if (!Files.exists(envFile)) {
            return;
        }
        try (InputStream is = Files.newInputStream(envFile)) {
            Properties props = new Properties();
            props.load(is);
            // Real environment variables win over .env entries
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                }
            }
        } catch (IOException | SecurityException e) {
            System.err.println("[ENV] Ignoring unreadable .env file: " + e.getMessage());
        }
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean requested = args.containsOption("seed");
        if (!requested && !properties.getSeed().isOnStartup()) {
            return;
        }
        String directory = firstOptionValue(args, "seed.dir");
        if (!ValidationUtils.hasText(directory)) {
            directory = properties.getSeed().getDirectory();
        }
        SeedService.SeedSummary summary = seedService.seed(Paths.get(directory));
        log.info("Seed completed: {} authors, {} books, {} reviews",
            summary.authors(), summary.books(), summary.reviews());
    }

    private String firstOptionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }
}
