package it.aw.regmetrics.registry;

import it.aw.regmetrics.model.CacheStats;
import it.aw.regmetrics.model.CachedTitle;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cache locale dei documenti scaricati dall'eCFR, persistita in un file DuckDB.
 * <p>
 * Tabelle:
 * <ul>
 *   <li>{@code titles}: un XML per coppia (titolo, data)</li>
 *   <li>{@code reference_feeds}: feed JSON di metadati (es. agencies.json) per nome</li>
 * </ul>
 * Un'unica connessione JDBC è condivisa da tutte le operazioni; l'accesso
 * è sincronizzato perché la connessione DuckDB non è thread-safe.
 * Le scritture sono upsert: un nuovo download sostituisce quello precedente.
 * L'XML è salvato come BLOB e riletto byte per byte, qualunque sia la sua codifica.
 */
@Component
public class TitleCache {

    private static final Logger log = LoggerFactory.getLogger(TitleCache.class);

    public static final String AGENCIES_FEED = "agencies.json";

    private static final String CREATE_TITLES = """
            CREATE TABLE IF NOT EXISTS titles (
                title_number  INTEGER   NOT NULL,
                issue_date    VARCHAR   NOT NULL,
                content       BLOB      NOT NULL,
                size_bytes    INTEGER   NOT NULL,
                fetched_at    TIMESTAMP NOT NULL,
                PRIMARY KEY (title_number, issue_date)
            )
            """;

    private static final String CREATE_FEEDS = """
            CREATE TABLE IF NOT EXISTS reference_feeds (
                feed_name   VARCHAR   PRIMARY KEY,
                content     VARCHAR   NOT NULL,
                fetched_at  TIMESTAMP NOT NULL
            )
            """;

    private final String dbPath;
    private Connection conn;

    public TitleCache(@Value("${store.cache.path}") String dbPath) {
        this.dbPath = dbPath;
    }

    @PostConstruct
    public void init() throws SQLException, IOException {
        Path path = Paths.get(dbPath);
        Files.createDirectories(path.toAbsolutePath().getParent());
        conn = DriverManager.getConnection("jdbc:duckdb:" + path.toAbsolutePath());
        migrateIfNeeded();
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TITLES);
            stmt.execute(CREATE_FEEDS);
        }
        log.info("TitleCache: tabelle 'titles' e 'reference_feeds' pronte su {}", path.toAbsolutePath());
    }

    /** Una cache creata con {@code content} testuale viene ricreata: i titoli saranno riscaricati. */
    private void migrateIfNeeded() throws SQLException {
        String contentType = null;
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT data_type FROM information_schema.columns " +
                "WHERE table_name = 'titles' AND column_name = 'content'")) {
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) contentType = rs.getString(1);
            }
        }
        if (contentType != null && !"BLOB".equalsIgnoreCase(contentType)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("DROP TABLE IF EXISTS titles");
            }
            log.warn("TitleCache: colonna 'content' di tipo {}, tabella 'titles' ricreata come BLOB", contentType);
        }
    }

    @PreDestroy
    public void close() {
        try {
            if (conn != null && !conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB cache: {}", e.getMessage());
        }
    }

    // -------------------------------------------------------------------------
    // titles
    // -------------------------------------------------------------------------

    public synchronized void storeTitle(int titleNumber, LocalDate date, byte[] xml) {
        String sql = """
                INSERT INTO titles (title_number, issue_date, content, size_bytes, fetched_at)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT (title_number, issue_date) DO UPDATE SET
                    content    = EXCLUDED.content,
                    size_bytes = EXCLUDED.size_bytes,
                    fetched_at = EXCLUDED.fetched_at
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, titleNumber);
            ps.setString(2, date.toString());
            ps.setBytes(3, xml);
            ps.setInt(4, xml.length);
            ps.setTimestamp(5, Timestamp.valueOf(LocalDateTime.now()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Errore salvataggio titolo " + titleNumber + " in cache", e);
        }
    }

    public synchronized Optional<byte[]> findTitle(int titleNumber, LocalDate date) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT content FROM titles WHERE title_number = ? AND issue_date = ?")) {
            ps.setInt(1, titleNumber);
            ps.setString(2, date.toString());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(rs.getBytes(1));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Errore lettura titolo " + titleNumber + " dalla cache", e);
        }
        return Optional.empty();
    }

    public synchronized List<CachedTitle> listTitles() {
        List<CachedTitle> result = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT title_number, issue_date, size_bytes, fetched_at FROM titles " +
                     "ORDER BY title_number, issue_date")) {
            while (rs.next()) {
                result.add(new CachedTitle(
                        rs.getInt("title_number"),
                        LocalDate.parse(rs.getString("issue_date")),
                        rs.getInt("size_bytes"),
                        rs.getTimestamp("fetched_at").toLocalDateTime()));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Errore lettura elenco titoli in cache", e);
        }
        return result;
    }

    // -------------------------------------------------------------------------
    // reference_feeds
    // -------------------------------------------------------------------------

    public synchronized void storeFeed(String feedName, String json) {
        String sql = """
                INSERT INTO reference_feeds (feed_name, content, fetched_at)
                VALUES (?, ?, ?)
                ON CONFLICT (feed_name) DO UPDATE SET
                    content    = EXCLUDED.content,
                    fetched_at = EXCLUDED.fetched_at
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, feedName);
            ps.setString(2, json);
            ps.setTimestamp(3, Timestamp.valueOf(LocalDateTime.now()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Errore salvataggio feed " + feedName, e);
        }
    }

    public synchronized Optional<String> findFeed(String feedName) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT content FROM reference_feeds WHERE feed_name = ?")) {
            ps.setString(1, feedName);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Errore lettura feed " + feedName, e);
        }
        return Optional.empty();
    }

    public synchronized CacheStats stats() {
        int titles;
        long bytes;
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT CAST(COUNT(*) AS INTEGER), CAST(COALESCE(SUM(size_bytes), 0) AS BIGINT) FROM titles")) {
            rs.next();
            titles = rs.getInt(1);
            bytes = rs.getLong(2);
        } catch (SQLException e) {
            throw new IllegalStateException("Errore calcolo statistiche cache", e);
        }
        return new CacheStats(titles, bytes, findFeed(AGENCIES_FEED).isPresent(), "DuckDB");
    }
}
