package com.example.lence.catalog;

import com.example.lence.error.ErrorKind;
import com.example.lence.error.LenceException;
import com.example.lence.model.ColumnInfo;
import com.example.lence.model.QueryResult;
import com.example.lence.model.SourceInfo;
import com.example.lence.model.SourceKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcSourceCatalogTest {

    @TempDir
    Path tempDir;

    private JdbcSourceCatalog catalog;

    @BeforeEach
    void openCatalog() throws Exception {
        Files.writeString(tempDir.resolve("orders.csv"),
                "id,region,amount\n" +
                "1,west,10\n" +
                "2,east,20\n" +
                "3,west,30\n");
        catalog = JdbcSourceCatalog.open(h2Url(), tempDir);
    }

    @AfterEach
    void closeCatalog() {
        catalog.close();
    }

    @Test
    void registersCsvAsQueryableView() throws Exception {
        catalog.register("orders", SourceKind.CSV, Path.of("orders.csv"), "Order lines");

        QueryResult result = catalog.execute("SELECT id, region FROM orders WHERE region = 'west' ORDER BY id");

        assertEquals(List.of("id", "region"), result.columns().stream().map(ColumnInfo::name).toList());
        assertNotNull(result.columns().get(0).type());
        assertEquals(List.of(List.of("1", "west"), List.of("3", "west")), result.data());
        assertEquals(2, result.rowCount());
    }

    @Test
    void keepsEngineColumnOrder() throws Exception {
        catalog.register("orders", SourceKind.CSV, Path.of("orders.csv"), "");

        QueryResult result = catalog.execute(
                "SELECT SUM(CAST(amount AS INT)) AS total, COUNT(*) AS n, MAX(region) AS last_region FROM orders");

        assertEquals(List.of("total", "n", "last_region"), result.columns().stream().map(ColumnInfo::name).toList());
        List<Object> row = result.data().get(0);
        assertEquals(60, ((Number) row.get(0)).intValue());
        assertEquals(3, ((Number) row.get(1)).intValue());
        assertEquals("west", row.get(2));
    }

    @Test
    void describesRegisteredSources() {
        catalog.register("orders", SourceKind.CSV, tempDir.resolve("orders.csv"), "Order lines");

        assertEquals(List.of(new SourceInfo("orders", SourceKind.CSV, "Order lines")), catalog.list());
        assertEquals(Optional.of(new SourceInfo("orders", SourceKind.CSV, "Order lines")), catalog.describe("orders"));
        assertEquals(Optional.empty(), catalog.describe("missing"));
        assertTrue(catalog.contains("orders"));
    }

    @Test
    void rejectsSourceNamesThatAreNotIdentifiers() {
        LenceException error = assertThrows(LenceException.class,
                () -> catalog.register("orders; DROP TABLE x", SourceKind.CSV, Path.of("orders.csv"), ""));

        assertEquals(ErrorKind.CONFIGURATION_ERROR, error.getKind());
        assertTrue(catalog.list().isEmpty());
    }

    @Test
    void rejectsParquetOnH2() {
        // H2 is the text-only fallback engine; DuckDB reads Parquet
        LenceException error = assertThrows(LenceException.class,
                () -> catalog.register("events", SourceKind.PARQUET, Path.of("events.parquet"), ""));

        assertEquals(ErrorKind.CONFIGURATION_ERROR, error.getKind());
        assertEquals(Optional.empty(), catalog.describe("events"));
    }

    @Test
    void surfacesEngineErrorsAsSqlExceptions() {
        catalog.register("orders", SourceKind.CSV, Path.of("orders.csv"), "");

        assertThrows(SQLException.class, () -> catalog.execute("SELEC id FROM orders"));
        assertThrows(SQLException.class, () -> catalog.execute("SELECT nope FROM orders"));
    }

    @Test
    void rejectsUnknownSourceKinds() {
        LenceException error = assertThrows(LenceException.class, () -> SourceKind.fromLabel("xlsx"));

        assertEquals(ErrorKind.CONFIGURATION_ERROR, error.getKind());
        assertEquals(SourceKind.PARQUET, SourceKind.fromLabel(" Parquet "));
    }

    @Test
    void choosesDialectFromJdbcUrl() {
        assertTrue(ViewDialect.forJdbcUrl("jdbc:h2:mem:x") instanceof ViewDialect.H2);
        assertTrue(ViewDialect.forJdbcUrl("jdbc:duckdb:") instanceof ViewDialect.DuckDb);
        assertEquals("CREATE OR REPLACE VIEW events AS SELECT * FROM read_parquet('/data/it''s.parquet')",
                new ViewDialect.DuckDb().createView("events", SourceKind.PARQUET, Path.of("/data/it's.parquet")));
        assertThrows(LenceException.class, () -> ViewDialect.forJdbcUrl("jdbc:postgresql://localhost/db"));
    }

    @Test
    void registrationWaitsForRunningQueries() throws Exception {
        BlockingFunctions.reset();
        catalog.execute("CREATE ALIAS HOLD_QUERY FOR 'com.example.lence.catalog.BlockingFunctions.hold'");
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<QueryResult> query = pool.submit(() -> catalog.execute("SELECT HOLD_QUERY() AS held"));
            assertTrue(BlockingFunctions.awaitEntered(), "query should be running");

            Future<?> registration = pool.submit(
                    () -> catalog.register("orders", SourceKind.CSV, Path.of("orders.csv"), ""));
            assertThrows(TimeoutException.class, () -> registration.get(300, TimeUnit.MILLISECONDS));
            assertFalse(registration.isDone());

            BlockingFunctions.release();
            assertEquals(1, query.get(10, TimeUnit.SECONDS).rowCount());
            registration.get(10, TimeUnit.SECONDS);
            assertTrue(catalog.contains("orders"));
        } finally {
            BlockingFunctions.release();
            pool.shutdownNow();
        }
    }

    static String h2Url() {
        return "jdbc:h2:mem:catalog-" + UUID.randomUUID() + ";DATABASE_TO_UPPER=false";
    }
}
