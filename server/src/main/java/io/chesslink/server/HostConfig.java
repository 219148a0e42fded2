// file: server/src/main/java/io/chesslink/server/HostConfig.java
package io.chesslink.server;

import io.chesslink.server.autosave.AutoSaveScheduler;

/**
 * Host node configuration parsed from CLI args.
 *
 * Supports:
 *  - peerId:              this process's identity; the host is the only writer
 *  - storeUrl:            base URL of the document store, or null for an in-memory store
 *  - peersConfigPath:     optional JSON list of peers to replicate to
 *  - autosave:            whether auto-save starts enabled
 *  - autosaveIntervalSec: interval trigger period
 *  - autosaveEveryMoves:  move-count trigger step
 */
public record HostConfig(
        String peerId,
        String storeUrl,
        String peersConfigPath,
        boolean autosave,
        long autosaveIntervalSec,
        int autosaveEveryMoves
) {

    public HostConfig {
        if (peerId == null || peerId.isBlank()) throw new IllegalArgumentException("peerId must not be blank");
        if (autosaveIntervalSec <= 0) throw new IllegalArgumentException("autosave interval must be > 0");
        if (autosaveEveryMoves <= 0) throw new IllegalArgumentException("autosave move step must be > 0");
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --peer-id,   -n   <id>
     *   --store-url, -s   <url>
     *   --peers-config, -c <path>
     *   --autosave        on|off
     *   --autosave-interval-seconds <seconds>
     *   --autosave-every-moves <n>
     *   --help,      -h
     */
    public static HostConfig fromArgs(String[] args) {
        // Defaults
        String peerId = "host";
        String storeUrl = null;
        String peersConfigPath = null;
        boolean autosave = true;
        long intervalSec = AutoSaveScheduler.DEFAULT_INTERVAL.toSeconds();
        int everyMoves = AutoSaveScheduler.DEFAULT_EVERY_MOVES;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--peer-id", "-n" -> {
                    ensureValue(args, i);
                    peerId = args[++i];
                }

                case "--store-url", "-s" -> {
                    ensureValue(args, i);
                    storeUrl = args[++i];
                }

                case "--peers-config", "-c" -> {
                    ensureValue(args, i);
                    peersConfigPath = args[++i];
                }

                case "--autosave" -> {
                    ensureValue(args, i);
                    String v = args[++i];
                    switch (v) {
                        case "on", "true" -> autosave = true;
                        case "off", "false" -> autosave = false;
                        default -> {
                            System.err.println("Invalid autosave value (on|off): " + v);
                            System.exit(1);
                        }
                    }
                }

                case "--autosave-interval-seconds" -> {
                    ensureValue(args, i);
                    try {
                        intervalSec = Long.parseLong(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid autosave-interval-seconds: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--autosave-every-moves" -> {
                    ensureValue(args, i);
                    try {
                        everyMoves = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid autosave-every-moves: " + args[i]);
                        System.exit(1);
                    }
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new HostConfig(peerId, storeUrl, peersConfigPath, autosave, intervalSec, everyMoves);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: chesslink-host [options]

            Options:
              --peer-id,      -n   Host identity (default: host)
              --store-url,    -s   Document store base URL, e.g. http://localhost:8090
                                   (default: in-memory store)
              --peers-config, -c   Path to JSON peers config (optional)
              --autosave           on|off (default: on)
              --autosave-interval-seconds   Interval trigger period (default: 60)
              --autosave-every-moves        Save every N half-moves (default: 5)
              --help,         -h   Show this help message
            """);
        System.exit(0);
    }
}
