// file: server/src/main/java/io/tagvault/server/ServerConfig.java
package io.tagvault.server;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tagvault.server.dto.JsonConfig;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

/**
 * Node configuration.
 *
 * Supports:
 *  - httpPort:             HTTP API port
 *  - dataDir:              root of the WAL and snapshot directories
 *  - remoteUrl:            base URL of the remote replica; null disables sync
 *  - syncIntervalSeconds:  period of background sync cycles (0 = only after writes)
 *  - remoteTimeoutSeconds: connect/request timeout for the remote replica
 *  - snapshotEvery:        compact the WAL into a snapshot every N commits
 *
 * Values come from defaults, then the optional JSON file (--config), then CLI flags.
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        String remoteUrl,
        long syncIntervalSeconds,
        long remoteTimeoutSeconds,
        int snapshotEvery
) {

    public ServerConfig {
        if (httpPort <= 0 || httpPort > 65535) throw new IllegalArgumentException("http-port out of range: " + httpPort);
        if (dataDir == null || dataDir.isBlank()) throw new IllegalArgumentException("data-dir must not be empty");
        if (syncIntervalSeconds < 0) throw new IllegalArgumentException("sync-interval-seconds must be >= 0");
        if (remoteTimeoutSeconds <= 0) throw new IllegalArgumentException("remote-timeout-seconds must be > 0");
        if (snapshotEvery <= 0) throw new IllegalArgumentException("snapshot-every must be > 0");
        if (remoteUrl != null && remoteUrl.isBlank()) remoteUrl = null;
        if (remoteUrl != null) {
            URI uri = URI.create(remoteUrl);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("remote-url must be an absolute http(s) URL: " + remoteUrl);
            }
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(8080, "./data", null, 60, 10, 1000);
    }

    public boolean syncEnabled() {
        return remoteUrl != null;
    }

    /**
     * Small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p <port>
     *   --data-dir,  -d <path>
     *   --remote-url, -r <url>
     *   --sync-interval-seconds <seconds>
     *   --remote-timeout-seconds <seconds>
     *   --snapshot-every <commits>
     *   --config,    -c <path to JSON file>
     *   --help,      -h
     *
     * @throws IllegalArgumentException on unknown flags, missing or bad values
     */
    public static ServerConfig fromArgs(String[] args) {
        ServerConfig base = defaults();

        // Config file first, so that CLI flags win regardless of position.
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i]) || "-c".equals(args[i])) {
                ensureValue(args, i);
                base = fromJsonFile(Path.of(args[i + 1]), base);
            }
        }

        int httpPort = base.httpPort();
        String dataDir = base.dataDir();
        String remoteUrl = base.remoteUrl();
        long syncInterval = base.syncIntervalSeconds();
        long remoteTimeout = base.remoteTimeoutSeconds();
        int snapshotEvery = base.snapshotEvery();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseInt("http-port", args[++i]);
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--remote-url", "-r" -> {
                    ensureValue(args, i);
                    remoteUrl = args[++i];
                }

                case "--sync-interval-seconds" -> {
                    ensureValue(args, i);
                    syncInterval = parseLong("sync-interval-seconds", args[++i]);
                }

                case "--remote-timeout-seconds" -> {
                    ensureValue(args, i);
                    remoteTimeout = parseLong("remote-timeout-seconds", args[++i]);
                }

                case "--snapshot-every" -> {
                    ensureValue(args, i);
                    snapshotEvery = parseInt("snapshot-every", args[++i]);
                }

                case "--config", "-c" -> i++; // already applied

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new ServerConfig(httpPort, dataDir, remoteUrl, syncInterval, remoteTimeout, snapshotEvery);
    }

    /** Overlay the non-null fields of a JSON config file on {@code base}. */
    public static ServerConfig fromJsonFile(Path path, ServerConfig base) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        JsonConfig cfg;
        try {
            cfg = mapper.readValue(path.toFile(), JsonConfig.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load config from " + path + ": " + e.getMessage(), e);
        }
        return new ServerConfig(
                cfg.httpPort != null ? cfg.httpPort : base.httpPort(),
                cfg.dataDir != null ? cfg.dataDir : base.dataDir(),
                cfg.remoteUrl != null ? cfg.remoteUrl : base.remoteUrl(),
                cfg.syncIntervalSeconds != null ? cfg.syncIntervalSeconds : base.syncIntervalSeconds(),
                cfg.remoteTimeoutSeconds != null ? cfg.remoteTimeoutSeconds : base.remoteTimeoutSeconds(),
                cfg.snapshotEvery != null ? cfg.snapshotEvery : base.snapshotEvery()
        );
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    static final String USAGE = """
            Usage: tagvault-server [options]

            Options:
              --http-port,   -p   HTTP port (default: 8080)
              --data-dir,    -d   Data directory for WAL and snapshots (default: ./data)
              --remote-url,  -r   Base URL of the remote replica (default: none, sync disabled)
              --sync-interval-seconds   Background sync period, 0 = only after writes (default: 60)
              --remote-timeout-seconds  Remote request timeout (default: 10)
              --snapshot-every          Snapshot after this many commits (default: 1000)
              --config,      -c   JSON config file; CLI flags override it
              --help,        -h   Show this help message
            """;

    private static void printHelpAndExit() {
        System.out.println(USAGE);
        System.exit(0);
    }
}
