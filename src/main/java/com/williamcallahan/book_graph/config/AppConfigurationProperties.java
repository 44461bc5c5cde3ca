/**
 * Main application configuration properties
 * Centralizes all app.* configuration properties for better type safety and IDE support
 *
 * @author William Callahan
 */

package com.williamcallahan.book_graph.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppConfigurationProperties {

    @NestedConfigurationProperty
    private Stores stores = new Stores();

    @NestedConfigurationProperty
    private Loader loader = new Loader();

    @NestedConfigurationProperty
    private Seed seed = new Seed();

    // Getters and setters
    public Stores getStores() { return stores; }
    public void setStores(Stores stores) { this.stores = stores; }

    public Loader getLoader() { return loader; }
    public void setLoader(Loader loader) { this.loader = loader; }

    public Seed getSeed() { return seed; }
    public void setSeed(Seed seed) { this.seed = seed; }

    public static class Stores {
        private RelationalStore authors = new RelationalStore("jdbc:postgresql://localhost:5432/postgres", "org.postgresql.Driver");
        private RelationalStore books = new RelationalStore("jdbc:mariadb://localhost:3306/appdb", "org.mariadb.jdbc.Driver");
        private EmbeddedStore reviews = new EmbeddedStore();
        private boolean initializeSchema = false;

        public RelationalStore getAuthors() { return authors; }
        public void setAuthors(RelationalStore authors) { this.authors = authors; }

        public RelationalStore getBooks() { return books; }
        public void setBooks(RelationalStore books) { this.books = books; }

        public EmbeddedStore getReviews() { return reviews; }
        public void setReviews(EmbeddedStore reviews) { this.reviews = reviews; }

        public boolean isInitializeSchema() { return initializeSchema; }
        public void setInitializeSchema(boolean initializeSchema) { this.initializeSchema = initializeSchema; }
    }

    /**
     * Connection settings for a pooled relational store.
     */
    public static class RelationalStore {
        private String url;
        private String username;
        private String password;
        private String driverClassName;
        private int maximumPoolSize = 10;
        private long connectionTimeoutMs = 30000;

        public RelationalStore() {
        }

        RelationalStore(String url, String driverClassName) {
            this.url = url;
            this.driverClassName = driverClassName;
        }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public String getDriverClassName() { return driverClassName; }
        public void setDriverClassName(String driverClassName) { this.driverClassName = driverClassName; }

        public int getMaximumPoolSize() { return maximumPoolSize; }
        public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }

        public long getConnectionTimeoutMs() { return connectionTimeoutMs; }
        public void setConnectionTimeoutMs(long connectionTimeoutMs) { this.connectionTimeoutMs = connectionTimeoutMs; }
    }

    /**
     * The embedded review store. Always a single connection.
     */
    public static class EmbeddedStore {
        private String path = "./reviews.db";
        private int busyTimeoutMs = 5000;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public int getBusyTimeoutMs() { return busyTimeoutMs; }
        public void setBusyTimeoutMs(int busyTimeoutMs) { this.busyTimeoutMs = busyTimeoutMs; }
    }

    public static class Loader {
        private int maxBatchSize = 0; // 0 = unlimited

        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }
    }

    public static class Seed {
        private String directory = ".";
        private boolean onStartup = false;

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public boolean isOnStartup() { return onStartup; }
        public void setOnStartup(boolean onStartup) { this.onStartup = onStartup; }
    }
}
