package io.notelite.server;

import io.notelite.core.DataVersion;
import io.notelite.server.backup.BackupRestoreService;
import io.notelite.server.backup.BackupScheduler;
import io.notelite.server.config.ConsistencyConfig;
import io.notelite.server.conflict.ConflictResolutionEngine;
import io.notelite.server.consistency.ChangeNotifier;
import io.notelite.server.consistency.ConsistencyManager;
import io.notelite.server.consistency.SingleOwnerExecutor;
import io.notelite.server.integrity.CacheConsistencyValidator;
import io.notelite.server.integrity.IntegrityDaemon;
import io.notelite.server.integrity.IntegrityMonitor;
import io.notelite.storage.JsonFileEntityStore;
import io.notelite.storage.backup.FileBackupRepository;
import io.notelite.storage.history.SnapshotPolicy;
import io.notelite.storage.history.VersionHistory;
import io.notelite.storage.history.VersionLog;
import io.notelite.storage.tx.TransactionManager;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a notelite process.
 *
 * Responsibilities:
 *  - Parse CLI flags and the optional JSON consistency config.
 *  - Wire storage (entity store, transactions, version history and its log, backup files).
 *  - Wire the consistency core (conflict engine, integrity monitor, backup service,
 *    notifier, single-owner executor, ConsistencyManager).
 *  - Start the integrity daemon, the periodic backup scheduler and the status endpoint.
 *  - Stop everything in reverse order on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws InterruptedException {
        loadLoggingConfig();
        var cfg = ServerConfig.fromArgs(args);
        var consistency = cfg.configPath() != null
                ? ConsistencyConfig.fromJsonFile(Path.of(cfg.configPath()))
                : ConsistencyConfig.DEFAULT;
        Path dataDir = Path.of(cfg.dataDir());
        Clock clock = Clock.systemUTC();

        // ------ Storage layer ------
        var store = new JsonFileEntityStore(dataDir.resolve("entities.json"));
        var txManager = new TransactionManager(store, consistency.maxConcurrentTransactions(),
                consistency.transactionTimeout(), clock);
        var versionLog = new VersionLog(dataDir.resolve("history.json"), consistency.historyPersistence());
        var history = new VersionHistory(store, txManager, consistency.historyLimits(),
                new SnapshotPolicy(consistency.snapshotEvery()), versionLog, clock);
        var backupFiles = new FileBackupRepository(dataDir.resolve("backups"));

        // ------ Consistency core ------
        var owner = new SingleOwnerExecutor("consistency-owner");
        var engine = new ConflictResolutionEngine(store, history::sequenceOf,
                consistency.simultaneousWindow(), consistency.businessWindow(),
                consistency.resolutionHistoryCapacity(), clock);
        var cacheValidator = new CacheConsistencyValidator(() -> history.current().map(DataVersion::checksum));
        // validators read the store on the owner thread, inline when already there
        var monitor = new IntegrityMonitor(() -> owner.call(store::findAll).join(),
                IntegrityMonitor.defaultValidators(cacheValidator), clock);
        var backups = new BackupRestoreService(store, txManager, backupFiles, monitor,
                consistency.backupRetention(), clock);
        var notifier = new ChangeNotifier();
        var manager = new ConsistencyManager(txManager, history, engine, monitor, backups, notifier, owner,
                consistency.bulkBackupThreshold(), clock);

        DataVersion head = manager.initialize().join();
        log.info("Loaded " + store.findAll().size() + " entities at version " + head.sequence()
                + " (history: " + consistency.historyPersistence() + ")");

        // ------ Background work ------
        var daemon = new IntegrityDaemon(monitor, consistency.quickCheckInterval(),
                consistency.comprehensiveCheckInterval(), report -> manager.repairCorruption().join());
        var backupScheduler = new BackupScheduler(
                () -> manager.backupIfDue(consistency.backupInterval()).join(), consistency.backupInterval());
        daemon.start();
        backupScheduler.start();

        // ------ Status endpoint ------
        StatusServer status = null;
        if (cfg.statusEnabled()) {
            status = new StatusServer(cfg.statusPort(), manager, monitor, txManager, history, engine, backups);
            status.start();
            System.out.printf("notelite status on http://localhost:%d/admin/health (data: %s)%n",
                    cfg.statusPort(), dataDir.toAbsolutePath());
        }

        // Shutdown hook
        var stopped = new CountDownLatch(1);
        StatusServer statusServer = status;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                if (statusServer != null) {
                    statusServer.stop();
                }
                backupScheduler.stop();
                daemon.stop();
                owner.close();
                notifier.close();
                txManager.close();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Shutdown did not complete cleanly", e);
            } finally {
                stopped.countDown();
            }
        }, "notelite-shutdown"));

        // every worker thread is a daemon; keep the process alive until shutdown
        stopped.await();
    }

    private static void loadLoggingConfig() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }
}
