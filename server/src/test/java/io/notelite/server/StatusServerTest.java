package io.notelite.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.notelite.core.ChangeKind;
import io.notelite.core.ChangeRecord;
import io.notelite.core.DataVersion;
import io.notelite.core.Entity;
import io.notelite.server.backup.BackupRestoreService;
import io.notelite.server.backup.BackupRetention;
import io.notelite.server.conflict.ConflictResolutionEngine;
import io.notelite.server.consistency.ChangeNotifier;
import io.notelite.server.consistency.ConsistencyManager;
import io.notelite.server.consistency.SingleOwnerExecutor;
import io.notelite.server.integrity.CacheConsistencyValidator;
import io.notelite.server.integrity.IntegrityMonitor;
import io.notelite.storage.InMemoryEntityStore;
import io.notelite.storage.backup.BackupTrigger;
import io.notelite.storage.backup.FileBackupRepository;
import io.notelite.storage.history.HistoryLimits;
import io.notelite.storage.history.SnapshotPolicy;
import io.notelite.storage.history.VersionHistory;
import io.notelite.storage.tx.TransactionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end checks of the status endpoint over a real Undertow listener.
 */
class StatusServerTest {

    private static final int PORT = 18481; // test-only port

    @TempDir
    Path dir;

    private final ObjectMapper json = new ObjectMapper();
    private SingleOwnerExecutor owner;
    private ChangeNotifier notifier;
    private TransactionManager tm;
    private ConsistencyManager manager;
    private StatusServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        Clock clock = Clock.systemUTC();
        var store = new InMemoryEntityStore();
        owner = new SingleOwnerExecutor("status-test-owner");
        tm = new TransactionManager(store, 10, Duration.ofSeconds(30), clock);
        var history = new VersionHistory(store, tm, HistoryLimits.DEFAULT, new SnapshotPolicy(10), null, clock);
        var engine = new ConflictResolutionEngine(store, history::sequenceOf);
        var monitor = new IntegrityMonitor(() -> owner.call(store::findAll).join(),
                IntegrityMonitor.defaultValidators(
                        new CacheConsistencyValidator(() -> history.current().map(DataVersion::checksum))),
                clock);
        var backups = new BackupRestoreService(store, tm, new FileBackupRepository(dir), monitor,
                BackupRetention.DEFAULT, clock);
        notifier = new ChangeNotifier();
        manager = new ConsistencyManager(tm, history, engine, monitor, backups, notifier, owner, 10, clock);
        manager.initialize().join();

        server = new StatusServer(PORT, manager, monitor, tm, history, engine, backups);
        server.start();
        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        server.stop();
        owner.close();
        notifier.close();
        tm.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + PORT + path))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void health_is_unknown_before_the_first_check() throws Exception {
        HttpResponse<String> res = get("/admin/health");

        assertEquals(200, res.statusCode());
        JsonNode body = json.readTree(res.body());
        assertEquals("UNKNOWN", body.get("status").asText());
        assertTrue(body.get("lastCheck").isNull());
    }

    @Test
    void health_reflects_a_completed_check() throws Exception {
        manager.performIntegrityCheck().join();

        JsonNode body = json.readTree(get("/admin/health").body());

        assertEquals("HEALTHY", body.get("status").asText());
        assertEquals(0, body.get("criticalIssues").asInt());
        assertFalse(body.get("lastFullCheck").isNull());
    }

    @Test
    void history_lists_versions_newest_first() throws Exception {
        Entity n = Entity.of(UUID.randomUUID(), "n", 1_000L, "body");
        assertTrue(manager.submit(ChangeRecord.user(new ChangeKind.EntityCreated(n), Instant.now())).join().applied());

        HttpResponse<String> res = get("/admin/history?limit=1");

        assertEquals(200, res.statusCode());
        JsonNode versions = json.readTree(res.body()).get("versions");
        assertEquals(1, versions.size());
        assertEquals("ENTITY_CREATED", versions.get(0).get("changeType").asText());
        assertTrue(versions.get(0).get("current").asBoolean());
    }

    @Test
    void bad_history_limit_is_a_client_error() throws Exception {
        assertEquals(400, get("/admin/history?limit=abc").statusCode());
        assertEquals(400, get("/admin/history?limit=0").statusCode());
    }

    @Test
    void backups_and_metrics_are_listed() throws Exception {
        assertTrue(manager.createBackup(BackupTrigger.MANUAL).join().success());

        JsonNode backups = json.readTree(get("/admin/backups").body()).get("backups");
        assertEquals(1, backups.size());
        assertEquals("MANUAL", backups.get(0).get("trigger").asText());

        JsonNode metrics = json.readTree(get("/admin/metrics").body());
        assertEquals(1, metrics.get("backups").get("backupsCreated").asLong());
        assertTrue(metrics.has("consistency"));
        assertTrue(metrics.has("transactions"));
        assertTrue(metrics.has("history"));
        assertTrue(metrics.has("conflicts"));
        assertTrue(metrics.has("integrity"));
    }

    @Test
    void unknown_path_and_writes_are_refused() throws Exception {
        assertEquals(404, get("/admin/nope").statusCode());

        HttpRequest post = HttpRequest.newBuilder(URI.create("http://localhost:" + PORT + "/admin/health"))
                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                .build();
        assertEquals(405, client.send(post, HttpResponse.BodyHandlers.ofString()).statusCode());
    }
}
