package io.notelite.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notelite.server.backup.BackupRestoreService;
import io.notelite.server.conflict.ConflictResolutionEngine;
import io.notelite.server.consistency.ConsistencyManager;
import io.notelite.server.integrity.HealthSummary;
import io.notelite.server.integrity.IntegrityMonitor;
import io.notelite.storage.backup.BackupHeader;
import io.notelite.storage.history.VersionHistory;
import io.notelite.storage.history.VersionSummary;
import io.notelite.storage.tx.TransactionManager;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only HTTP diagnostics over the consistency core.
 *
 * Path layout:
 *   - GET /admin/health              health summary of the last integrity check
 *   - GET /admin/metrics             counters of every component
 *   - GET /admin/history?limit=n     newest-first version summaries (default 20)
 *   - GET /admin/backups             backups on disk, newest first
 *
 * Requests are handled on Undertow worker threads; anything that touches the store
 * goes through the ConsistencyManager and waits for its owner thread.
 */
public final class StatusServer {
    static final int DEFAULT_HISTORY_LIMIT = 20;
    static final int MAX_HISTORY_LIMIT = 1000;

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final ConsistencyManager manager;
    private final IntegrityMonitor monitor;
    private final TransactionManager txManager;
    private final VersionHistory history;
    private final ConflictResolutionEngine engine;
    private final BackupRestoreService backups;

    public StatusServer(
            int port,
            ConsistencyManager manager,
            IntegrityMonitor monitor,
            TransactionManager txManager,
            VersionHistory history,
            ConflictResolutionEngine engine,
            BackupRestoreService backups
    ) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.txManager = Objects.requireNonNull(txManager, "txManager");
        this.history = Objects.requireNonNull(history, "history");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.backups = Objects.requireNonNull(backups, "backups");

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(new BlockingHandler(this::route))
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- handlers ----------

    private void route(HttpServerExchange exchange) {
        long start = System.nanoTime();
        String path = exchange.getRequestPath();
        String method = exchange.getRequestMethod().toString();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        if (!"GET".equals(method)) {
            send(exchange, 405, Map.of("error", "method not allowed"));
            RequestLogger.logRequest(method, path, 405, elapsedMillis(start), -1, null);
            return;
        }

        int status = 200;
        long coreMs = -1L;
        Throwable error = null;
        try {
            switch (path) {
                case "/admin/health" -> send(exchange, status, health(monitor.healthSummary()));
                case "/admin/metrics" -> send(exchange, status, metrics());
                case "/admin/history" -> {
                    int limit = limit(exchange);
                    long cStart = System.nanoTime();
                    List<VersionSummary> versions = manager.history(limit).join();
                    coreMs = elapsedMillis(cStart);
                    send(exchange, status, Map.of("versions", versions.stream().map(StatusServer::version).toList()));
                }
                case "/admin/backups" -> {
                    long cStart = System.nanoTime();
                    List<BackupHeader> list = manager.listBackups().join();
                    coreMs = elapsedMillis(cStart);
                    send(exchange, status, Map.of("backups", list.stream().map(StatusServer::backup).toList()));
                }
                default -> {
                    status = 404;
                    send(exchange, status, Map.of("error", "not found"));
                }
            }
        } catch (IllegalArgumentException bad) {
            status = 400;
            send(exchange, status, Map.of("error", bad.getMessage()));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(exchange, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            RequestLogger.logRequest(method, path, status, elapsedMillis(start), coreMs, error);
        }
    }

    private Map<String, Object> metrics() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("consistency", manager.metrics().snapshot());
        out.put("transactions", txManager.metrics().snapshot());
        out.put("history", history.metrics().snapshot());
        out.put("conflicts", engine.metrics().snapshot());
        out.put("integrity", monitor.metrics().snapshot());
        out.put("backups", backups.metrics().snapshot());
        return out;
    }

    private static int limit(HttpServerExchange ex) {
        Deque<String> values = ex.getQueryParameters().get("limit");
        if (values == null || values.isEmpty()) {
            return DEFAULT_HISTORY_LIMIT;
        }
        int limit;
        try {
            limit = Integer.parseInt(values.peekFirst());
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException("invalid numeric query param: limit");
        }
        if (limit <= 0 || limit > MAX_HISTORY_LIMIT) {
            throw new IllegalArgumentException("limit must be in [1, " + MAX_HISTORY_LIMIT + "]");
        }
        return limit;
    }

    // ---------- views ----------

    private static Map<String, Object> health(HealthSummary h) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", h.checked() ? h.status().name() : "UNKNOWN");
        out.put("activeIssues", h.activeIssues());
        out.put("criticalIssues", h.criticalIssues());
        out.put("warningIssues", h.warningIssues());
        out.put("lastCheck", text(h.lastCheck()));
        out.put("lastFullCheck", text(h.lastFullCheck()));
        return out;
    }

    private static Map<String, Object> version(VersionSummary v) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("versionId", v.versionId());
        out.put("sequence", v.sequence());
        out.put("timestamp", text(v.timestamp()));
        out.put("description", v.description());
        out.put("changeType", v.changeType().name());
        out.put("snapshot", v.snapshot());
        out.put("replayable", v.replayable());
        out.put("current", v.current());
        return out;
    }

    private static Map<String, Object> backup(BackupHeader b) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", b.id());
        out.put("createdAt", text(b.createdAt()));
        out.put("trigger", b.trigger().name());
        out.put("checksum", b.checksum());
        out.put("sizeBytes", b.sizeBytes());
        out.put("entityCount", b.entityCount());
        return out;
    }

    private static String text(Instant at) {
        return at == null ? null : at.toString();
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
