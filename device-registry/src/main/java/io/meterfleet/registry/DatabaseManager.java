package io.meterfleet.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

public class DatabaseManager {
    
    private static final Logger logger = LoggerFactory.getLogger(DatabaseManager.class);
    
    // Configuration via system properties with defaults
    public static final String DEFAULT_URL = "jdbc:sqlite:iot_devices.db";
    private static final String SQLITE_BUSY_TIMEOUT_MS = "30000";

    private final String url;
    private final String user;
    private final String password;
    private final Dialect dialect;

    public enum Dialect {
        SQLITE("schema-sqlite.sql"),
        POSTGRESQL("schema-postgresql.sql");

        private final String schemaResource;

        Dialect(String schemaResource) {
            this.schemaResource = schemaResource;
        }

        public String getSchemaResource() { return schemaResource; }

        static Dialect fromUrl(String url) {
            if (url.startsWith("jdbc:sqlite:")) {
                return SQLITE;
            }
            if (url.startsWith("jdbc:postgresql:")) {
                return POSTGRESQL;
            }
            throw new IllegalArgumentException("Unsupported JDBC URL: " + url);
        }
    }
    
    public DatabaseManager(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
        this.dialect = Dialect.fromUrl(url);
        initializeDatabase();
    }

    public static DatabaseManager fromSystemProperties() {
        return new DatabaseManager(
            System.getProperty("db.url", DEFAULT_URL),
            System.getProperty("db.user", ""),
            System.getProperty("db.password", "")
        );
    }
    
    private void initializeDatabase() {
        try (Connection conn = getConnection()) {
            logger.info("Connected to {} database: {}", dialect, url);
            createSchema(conn);
        } catch (Exception e) {
            logger.error("Failed to initialize database", e);
            throw new RuntimeException("Database initialization failed", e);
        }
    }
    
    private void createSchema(Connection conn) throws Exception {
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream(dialect.getSchemaResource())) {
            if (schemaStream == null) {
                throw new RuntimeException("Schema file not found: " + dialect.getSchemaResource());
            }
            
            String schema = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
            // Strip "--" comments line by line, then split on ';'
            StringBuilder cleanedSchema = new StringBuilder();
            for (String line : schema.split("\n")) {
                int commentIndex = line.indexOf("--");
                if (commentIndex >= 0) {
                    line = line.substring(0, commentIndex);
                }
                if (!line.trim().isEmpty()) {
                    cleanedSchema.append(line).append("\n");
                }
            }
            String[] statements = cleanedSchema.toString().split(";");
            
            try (Statement stmt = conn.createStatement()) {
                int executedCount = 0;
                for (String statement : statements) {
                    String trimmed = statement.trim();
                    if (trimmed.isEmpty()) {
                        continue;
                    }
                    
                    logger.debug("Executing SQL statement {}", executedCount + 1);
                    try {
                        stmt.execute(trimmed);
                        executedCount++;
                    } catch (SQLException e) {
                        String errorMsg = e.getMessage() != null ? e.getMessage() : "";
                        // Concurrent worker processes may race on IF NOT EXISTS
                        boolean isIgnorable = errorMsg.contains("already exists") 
                            || errorMsg.contains("duplicate");
                        
                        if (!isIgnorable) {
                            logger.error("Failed to execute SQL statement: {}", trimmed.substring(0, Math.min(100, trimmed.length())));
                            throw e;
                        }
                        logger.debug("Ignoring expected SQL message: {}", errorMsg);
                    }
                }
                logger.info("Database schema ready. Executed {} statements.", executedCount);
            }
        }
    }
    
    /**
     * Opens a new connection per call; callers close it with try-with-resources.
     * SQLite files are shared by several worker processes, so writers wait on the lock
     * instead of failing immediately.
     */
    public Connection getConnection() {
        try {
            Properties props = new Properties();
            if (dialect == Dialect.SQLITE) {
                props.setProperty("busy_timeout", SQLITE_BUSY_TIMEOUT_MS);
            } else {
                props.setProperty("user", user);
                props.setProperty("password", password);
            }
            return DriverManager.getConnection(url, props);
        } catch (SQLException e) {
            logger.error("Failed to get database connection", e);
            throw new RuntimeException("Database connection failed", e);
        }
    }

    public String getUrl() {
        return url;
    }

    public Dialect getDialect() {
        return dialect;
    }
    
    public void close() {
        // Connections are opened per call and closed by the caller
        logger.debug("DatabaseManager.close() called - no pooled connections to release");
    }
}
