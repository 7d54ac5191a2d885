package com.postq;

import com.postq.config.PostQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned scripts under {@code postq/migration} once per
 * database, recording a SHA-256 checksum of each. On PostgreSQL an advisory
 * lock keeps concurrently starting nodes from migrating at the same time.
 */
@Component
@ConditionalOnProperty(prefix = "postq.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class PostQSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(PostQSchemaInitializer.class);
    private static final Pattern SCRIPT_NAME = Pattern.compile("^V([0-9]+)__([A-Za-z0-9_\\-]+)\\.sql$");
    private static final String SCRIPT_LOCATION = "classpath*:postq/migration/V*__*.sql";
    private static final String HISTORY_TABLE = "postq_schema_history";
    private static final long ADVISORY_LOCK_KEY = 7_301_448_296_512_004_117L;

    private final DataSource dataSource;
    private final boolean failOnMigrationError;
    private final PathMatchingResourcePatternResolver resourceResolver = new PathMatchingResourcePatternResolver();

    public PostQSchemaInitializer(DataSource dataSource, PostQProperties properties) {
        this.dataSource = dataSource;
        this.failOnMigrationError = properties.getDatabase().isFailOnMigrationError();
    }

    @Override
    public void afterPropertiesSet() {
        try {
            int applied = migrate();
            if (applied > 0) {
                log.info("Applied {} PostQ migration(s)", applied);
            } else {
                log.info("PostQ schema is up to date");
            }
        } catch (Exception e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("Failed to migrate the PostQ schema", e);
            }
            log.error("Failed to migrate the PostQ schema (continuing because "
                    + "postq.database.fail-on-migration-error=false)", e);
        }
    }

    int migrate() throws SQLException, IOException {
        List<Script> scripts = loadScripts();
        if (scripts.isEmpty()) {
            throw new IllegalStateException("No PostQ migrations found at " + SCRIPT_LOCATION);
        }

        try (Connection connection = dataSource.getConnection()) {
            boolean locked = lock(connection);
            try {
                createHistoryTable(connection);
                Map<Integer, String> appliedChecksums = appliedChecksums(connection);
                verify(scripts, appliedChecksums);

                int applied = 0;
                for (Script script : scripts) {
                    if (!appliedChecksums.containsKey(script.version())) {
                        apply(connection, script);
                        applied++;
                    }
                }
                return applied;
            } finally {
                if (locked) {
                    unlock(connection);
                }
            }
        }
    }

    private List<Script> loadScripts() throws IOException {
        List<Script> scripts = new ArrayList<>();
        Map<Integer, String> fileByVersion = new LinkedHashMap<>();
        for (Resource resource : resourceResolver.getResources(SCRIPT_LOCATION)) {
            String fileName = resource.getFilename();
            if (fileName == null) {
                continue;
            }
            Matcher matcher = SCRIPT_NAME.matcher(fileName);
            if (!matcher.matches()) {
                throw new IllegalStateException("Migration file '" + fileName
                        + "' does not follow V{version}__{description}.sql");
            }
            int version = Integer.parseInt(matcher.group(1));
            String previous = fileByVersion.putIfAbsent(version, fileName);
            if (previous != null) {
                throw new IllegalStateException("Migration version V" + version + " is used by both " + previous
                        + " and " + fileName);
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            scripts.add(new Script(version, matcher.group(2).replace('_', ' '), resource, checksum(sql)));
        }
        scripts.sort(Comparator.comparingInt(Script::version));
        return scripts;
    }

    private void createHistoryTable(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        version INTEGER PRIMARY KEY,
                        description VARCHAR(255) NOT NULL,
                        checksum VARCHAR(64) NOT NULL,
                        installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP
                    )
                    """.formatted(HISTORY_TABLE));
        }
    }

    private Map<Integer, String> appliedChecksums(Connection connection) throws SQLException {
        Map<Integer, String> applied = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT version, checksum FROM " + HISTORY_TABLE + " ORDER BY version");
                ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                applied.put(rs.getInt("version"), rs.getString("checksum"));
            }
        }
        return applied;
    }

    private void verify(List<Script> scripts, Map<Integer, String> appliedChecksums) {
        for (Map.Entry<Integer, String> applied : appliedChecksums.entrySet()) {
            Script script = scripts.stream()
                    .filter(candidate -> candidate.version() == applied.getKey())
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("Migration V" + applied.getKey()
                            + " is recorded in " + HISTORY_TABLE + " but missing from the classpath"));
            if (!script.checksum().equals(applied.getValue())) {
                throw new IllegalStateException("Migration V" + script.version()
                        + " changed after it was applied (checksum mismatch)");
            }
        }
    }

    private void apply(Connection connection, Script script) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            ScriptUtils.executeSqlScript(connection, new EncodedResource(script.resource(), StandardCharsets.UTF_8));
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO " + HISTORY_TABLE + " (version, description, checksum) VALUES (?, ?, ?)")) {
                statement.setInt(1, script.version());
                statement.setString(2, script.description());
                statement.setString(3, script.checksum());
                statement.executeUpdate();
            }
            connection.commit();
            log.info("Applied PostQ migration V{} ({})", script.version(), script.description());
        } catch (SQLException | RuntimeException e) {
            connection.rollback();
            throw new IllegalStateException("Failed to apply PostQ migration V" + script.version(), e);
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private boolean lock(Connection connection) throws SQLException {
        String product = connection.getMetaData().getDatabaseProductName();
        if (product == null || !product.toLowerCase(Locale.ROOT).contains("postgresql")) {
            return false;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        }
        return true;
    }

    private void unlock(Connection connection) {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        } catch (SQLException e) {
            log.warn("Failed to release the PostQ migration lock", e);
        }
    }

    private static String checksum(String sql) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(sql.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private record Script(int version, String description, Resource resource, String checksum) {
    }
}
