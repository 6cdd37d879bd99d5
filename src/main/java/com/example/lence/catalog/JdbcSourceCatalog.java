package com.example.lence.catalog;

import com.example.lence.error.LenceException;
import com.example.lence.model.ColumnInfo;
import com.example.lence.model.QueryResult;
import com.example.lence.model.SourceInfo;
import com.example.lence.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Array;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * {@link SourceCatalog} over one shared JDBC connection. Each source is a view over its file. Queries share the
 * read lock; registering a source takes the write lock so views never change under a running query.
 */
public class JdbcSourceCatalog implements SourceCatalog {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcSourceCatalog.class);
    private static final Pattern SOURCE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** In-memory DuckDB: typed CSV columns and Parquet support. */
    public static final String DEFAULT_JDBC_URL = "jdbc:duckdb:";
    /** In-memory H2. CSV columns come back as text and Parquet is not readable. */
    public static final String H2_JDBC_URL = "jdbc:h2:mem:lence;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1";

    private final Connection connection;
    private final ViewDialect dialect;
    private final Path baseDir;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, SourceInfo> sources = new LinkedHashMap<>();

    public JdbcSourceCatalog(Connection connection, ViewDialect dialect, Path baseDir) {
        this.connection = connection;
        this.dialect = dialect;
        this.baseDir = baseDir;
    }

    public static JdbcSourceCatalog open(String jdbcUrl, Path baseDir) {
        String url = jdbcUrl == null || jdbcUrl.isBlank() ? DEFAULT_JDBC_URL : jdbcUrl;
        ViewDialect dialect = ViewDialect.forJdbcUrl(url);
        try {
            Connection connection = DriverManager.getConnection(url);
            LOGGER.info("Source catalog connected to {}", url);
            return new JdbcSourceCatalog(connection, dialect, baseDir);
        } catch (SQLException e) {
            throw LenceException.configuration("Cannot open source catalog at " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void register(String name, SourceKind kind, Path location, String description) {
        if (name == null || !SOURCE_NAME.matcher(name).matches()) {
            throw LenceException.configuration("Invalid source name '" + name + "'; use letters, digits and underscores");
        }
        if (location == null) {
            throw LenceException.configuration("Source '" + name + "' has no path");
        }
        Path resolved = baseDir != null && !location.isAbsolute() ? baseDir.resolve(location) : location;
        String ddl = dialect.createView(name, kind, resolved.normalize());

        lock.writeLock().lock();
        try (Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            sources.put(name, new SourceInfo(name, kind, description == null ? "" : description));
            LOGGER.info("Registered {} source '{}' from {}", kind.label(), name, resolved);
        } catch (SQLException e) {
            throw LenceException.configuration("Failed to register source '" + name + "': " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public QueryResult execute(String sql) throws SQLException {
        lock.readLock().lock();
        try (Statement statement = connection.createStatement()) {
            if (!statement.execute(sql)) {
                return QueryResult.of(List.of(), List.of());
            }
            try (ResultSet resultSet = statement.getResultSet()) {
                return readResult(resultSet);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<SourceInfo> list() {
        lock.readLock().lock();
        try {
            return List.copyOf(sources.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<SourceInfo> describe(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(sources.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            connection.close();
        } catch (SQLException e) {
            LOGGER.warn("Error while closing source catalog connection", e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private QueryResult readResult(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<ColumnInfo> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(new ColumnInfo(metaData.getColumnLabel(i), metaData.getColumnTypeName(i)));
        }
        List<List<Object>> rows = new ArrayList<>();
        while (resultSet.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(toPlainValue(resultSet.getObject(i)));
            }
            rows.add(row);
        }
        return QueryResult.of(columns, rows);
    }

    private Object toPlainValue(Object value) throws SQLException {
        if (value == null || value instanceof Number || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof java.util.Date || value instanceof TemporalAccessor || value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof Clob clob) {
            return clob.getSubString(1, (int) clob.length());
        }
        if (value instanceof Array array) {
            List<Object> elements = new ArrayList<>();
            for (Object element : (Object[]) array.getArray()) {
                elements.add(toPlainValue(element));
            }
            return elements;
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        return value.toString();
    }
}
