package it.aw.documentsearch.store;

import it.aw.documentsearch.exception.StoreException;
import it.aw.documentsearch.model.Chunk;
import it.aw.documentsearch.model.StoredChunk;
import it.aw.documentsearch.model.VectorMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Vector store persistito nella tabella {@code chunks} di un file DuckDB
 * ({@code <persistDir>/vectors.duckdb}).
 * <p>
 * Tutte le collection condividono la tabella e sono distinte dalla colonna
 * {@code collection}. La distanza kNN è calcolata in SQL con le funzioni
 * {@code list_*} di DuckDB secondo la {@link DistanceMetric} configurata.
 * <p>
 * Un'unica connessione JDBC è condivisa da tutte le operazioni; l'accesso
 * è sincronizzato perché DuckDBConnection non è thread-safe.
 */
public class DuckDbVectorStore implements VectorStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DuckDbVectorStore.class);

    public static final String DB_FILENAME = "vectors.duckdb";

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS chunks (
                collection VARCHAR NOT NULL,
                id         VARCHAR NOT NULL,
                seq        INTEGER NOT NULL,
                text       VARCHAR NOT NULL,
                page       INTEGER,
                source     VARCHAR,
                file_path  VARCHAR,
                embedding  FLOAT[] NOT NULL
            )
            """;

    private static final String INSERT = """
            INSERT INTO chunks (collection, id, seq, text, page, source, file_path, embedding)
            VALUES (?, ?, ?, ?, ?, ?, ?, CAST(CAST(? AS VARCHAR) AS FLOAT[]))
            """;

    private final Path dbPath;
    private final DistanceMetric distanceMetric;
    private final Connection conn;

    public DuckDbVectorStore(Path persistDir, DistanceMetric distanceMetric) {
        this.dbPath = persistDir.resolve(DB_FILENAME).toAbsolutePath();
        this.distanceMetric = distanceMetric;
        try {
            Files.createDirectories(dbPath.getParent());
            this.conn = DriverManager.getConnection("jdbc:duckdb:" + dbPath);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(CREATE_TABLE);
            }
        } catch (SQLException | IOException e) {
            throw new StoreException("Impossibile aprire il vector store " + dbPath + ": " + e.getMessage(), e);
        }
        log.info("VectorStore: tabella 'chunks' pronta su {} (metrica {})", dbPath, distanceMetric);
    }

    @Override
    public DistanceMetric getDistanceMetric() {
        return distanceMetric;
    }

    @Override
    public synchronized int count(String collection) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT COUNT(*) FROM chunks WHERE collection = ?")) {
            ps.setString(1, collection);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Errore conteggio chunk: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized int deleteAll(String collection) {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM chunks WHERE collection = ?")) {
            ps.setString(1, collection);
            int deleted = ps.executeUpdate();
            log.debug("VectorStore: {} chunk rimossi dalla collection '{}'", deleted, collection);
            return deleted;
        } catch (SQLException e) {
            throw new StoreException("Errore cancellazione collection '" + collection + "': " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void add(String collection, List<Chunk> chunks, List<float[]> vectors) {
        if (chunks.size() != vectors.size()) {
            throw new StoreException("chunk e vettori non allineati: " + chunks.size() + " != " + vectors.size());
        }
        Set<String> ids = new HashSet<>();
        for (Chunk chunk : chunks) {
            if (!ids.add(chunk.id())) {
                throw new StoreException("id duplicato: " + chunk.id());
            }
        }
        int existing = count(collection);
        if (existing > 0 && containsAnyId(collection, ids)) {
            throw new StoreException("uno o più id già presenti nella collection '" + collection + "'");
        }

        try {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(INSERT)) {
                for (int i = 0; i < chunks.size(); i++) {
                    Chunk chunk = chunks.get(i);
                    ps.setString(1, collection);
                    ps.setString(2, chunk.id());
                    ps.setInt(3, existing + i);
                    ps.setString(4, chunk.text());
                    ps.setInt(5, chunk.page());
                    ps.setString(6, chunk.source());
                    ps.setString(7, chunk.filePath());
                    ps.setString(8, toLiteral(vectors.get(i)));
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            conn.commit();
        } catch (SQLException e) {
            rollbackQuietly();
            throw new StoreException("Errore inserimento nella collection '" + collection + "': " + e.getMessage(), e);
        } finally {
            restoreAutoCommit();
        }
        log.debug("VectorStore: {} chunk inseriti nella collection '{}'", chunks.size(), collection);
    }

    @Override
    public synchronized List<VectorMatch> query(String collection, float[] vector, int k) {
        String sql = "SELECT id, text, page, source, file_path, CAST("
                + distanceMetric.sqlExpression("CAST(CAST(? AS VARCHAR) AS FLOAT[])") + " AS DOUBLE) AS distance "
                + "FROM chunks WHERE collection = ? ORDER BY distance ASC, seq ASC LIMIT ?";
        List<VectorMatch> matches = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, toLiteral(vector));
            ps.setString(2, collection);
            ps.setInt(3, k);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    matches.add(new VectorMatch(toStoredChunk(rs), rs.getDouble("distance")));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Errore query sulla collection '" + collection + "': " + e.getMessage(), e);
        }
        return matches;
    }

    @Override
    public synchronized List<StoredChunk> peek(String collection, int limit) {
        List<StoredChunk> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT id, text, page, source, file_path FROM chunks "
                        + "WHERE collection = ? ORDER BY seq ASC LIMIT ?")) {
            ps.setString(1, collection);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) result.add(toStoredChunk(rs));
            }
        } catch (SQLException e) {
            throw new StoreException("Errore lettura collection '" + collection + "': " + e.getMessage(), e);
        }
        return result;
    }

    @Override
    public synchronized void close() {
        try {
            if (!conn.isClosed()) conn.close();
            log.info("VectorStore chiuso: {}", dbPath);
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB vector store: {}", e.getMessage());
        }
    }

    private boolean containsAnyId(String collection, Set<String> ids) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM chunks WHERE collection = ?")) {
            ps.setString(1, collection);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    if (ids.contains(rs.getString(1))) return true;
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Errore lettura id della collection '" + collection + "': " + e.getMessage(), e);
        }
        return false;
    }

    private StoredChunk toStoredChunk(ResultSet rs) throws SQLException {
        int page = rs.getInt("page");
        Integer pageOrNull = rs.wasNull() ? null : page;
        return new StoredChunk(
                rs.getString("id"),
                rs.getString("text"),
                pageOrNull,
                rs.getString("source"),
                rs.getString("file_path")
        );
    }

    /** Letterale lista DuckDB, es. {@code [0.1,-0.25,3.0E-4]}. */
    static String toLiteral(float[] vector) {
        StringBuilder sb = new StringBuilder(vector.length * 12 + 2).append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(vector[i]);
        }
        return sb.append(']').toString();
    }

    private void rollbackQuietly() {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback fallito sul vector store: {}", e.getMessage());
        }
    }

    private void restoreAutoCommit() {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Impossibile ripristinare autocommit sul vector store: {}", e.getMessage());
        }
    }
}
