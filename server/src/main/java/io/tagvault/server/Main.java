// file: server/src/main/java/io/tagvault/server/Main.java
package io.tagvault.server;

import io.tagvault.core.LastWriteWinsMerger;
import io.tagvault.core.MutationClock;
import io.tagvault.server.command.CommandRouter;
import io.tagvault.server.pipeline.CommandPipeline;
import io.tagvault.server.store.EntityStore;
import io.tagvault.server.sync.BackgroundSyncWorker;
import io.tagvault.server.sync.HttpRemoteReplica;
import io.tagvault.server.sync.RetryPolicy;
import io.tagvault.server.sync.SyncCoordinator;
import io.tagvault.server.sync.SyncTrigger;
import io.tagvault.storage.DurableBackingStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a single tagvault node.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and the optional JSON file).
 *  - Wire the storage layer (WAL, snapshots) behind the entity store.
 *  - Create the command pipeline and router.
 *  - When a remote replica is configured, wire the sync coordinator and its background worker.
 *  - Start the HTTP server.
 */
public final class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();

        ServerConfig cfg;
        try {
            cfg = ServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(ServerConfig.USAGE);
            System.exit(1);
            return;
        }

        // ------ Storage Layer -------
        var backing = DurableBackingStore.open(Path.of(cfg.dataDir()), cfg.snapshotEvery());

        // ------ Local data path -------
        var store = new EntityStore(backing, MutationClock.system());
        var pipeline = new CommandPipeline(store);
        var router = new CommandRouter(pipeline);

        // ------ Sync (optional) -------
        SyncCoordinator coordinator = null;
        BackgroundSyncWorker worker = null;
        SyncTrigger trigger = SyncTrigger.NOOP;
        if (cfg.syncEnabled()) {
            var remote = new HttpRemoteReplica(
                    URI.create(cfg.remoteUrl()),
                    Duration.ofSeconds(cfg.remoteTimeoutSeconds()));
            coordinator = new SyncCoordinator(pipeline, remote, new LastWriteWinsMerger(), Clock.systemUTC());
            worker = new BackgroundSyncWorker(
                    coordinator,
                    RetryPolicy.defaults(),
                    Duration.ofSeconds(cfg.syncIntervalSeconds()));
            pipeline.attachSyncTrigger(worker);
            worker.start();
            trigger = worker;
        }

        // ------ HTTP layer ------
        var web = new WebServer(
                cfg.httpPort(),
                router,
                coordinator,
                trigger,
                Duration.ofSeconds(Math.max(30, cfg.remoteTimeoutSeconds() * 4)));
        web.start();

        LOG.info(String.format("tagvault listening on http://localhost:%d (data=%s, sync=%s)",
                cfg.httpPort(), cfg.dataDir(), cfg.syncEnabled() ? cfg.remoteUrl() : "disabled"));

        // Shutdown hook
        final BackgroundSyncWorker workerRef = worker;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                if (workerRef != null) workerRef.stop();
                web.stop();
                backing.close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Error during shutdown", e);
            }
        }, "shutdown"));
    }

    /** Load logging.properties from the classpath unless a file was given on the command line. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging.properties: " + e.getMessage());
        }
    }
}
