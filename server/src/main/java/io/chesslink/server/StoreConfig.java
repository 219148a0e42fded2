// file: server/src/main/java/io/chesslink/server/StoreConfig.java
package io.chesslink.server;

/**
 * Document store server configuration parsed from CLI args.
 *
 * @param httpPort HTTP listen port
 * @param dataDir  directory holding one JSON file per saved game
 */
public record StoreConfig(int httpPort, String dataDir) {

    public StoreConfig {
        if (httpPort <= 0 || httpPort > 65535) throw new IllegalArgumentException("httpPort out of range");
        if (dataDir == null || dataDir.isBlank()) throw new IllegalArgumentException("dataDir must not be blank");
    }

    /**
     * Supported flags:
     *   --http-port, -p <port>
     *   --data-dir,  -d <path>
     *   --help,      -h
     */
    public static StoreConfig fromArgs(String[] args) {
        int httpPort = 8090;
        String dataDir = "./data/games";

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        httpPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid http-port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new StoreConfig(httpPort, dataDir);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: chesslink-store [options]

            Options:
              --http-port, -p   HTTP port (default: 8090)
              --data-dir,  -d   Directory for saved games (default: ./data/games)
              --help,      -h   Show this help message
            """);
        System.exit(0);
    }
}
