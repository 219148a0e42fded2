// file: client/src/main/java/io/chesslink/client/PeerConfig.java
package io.chesslink.client;

/**
 * Peer node configuration parsed from CLI args.
 *
 * @param peerId   this peer's identity (must match the host's peers config)
 * @param grpcPort port the replication endpoint listens on
 */
public record PeerConfig(String peerId, int grpcPort) {

    public PeerConfig {
        if (peerId == null || peerId.isBlank()) throw new IllegalArgumentException("peerId must not be blank");
        if (grpcPort <= 0 || grpcPort > 65535) throw new IllegalArgumentException("grpcPort out of range");
    }

    /**
     * Supported flags:
     *   --peer-id,   -n <id>
     *   --grpc-port, -g <port>
     *   --help,      -h
     */
    public static PeerConfig fromArgs(String[] args) {
        String peerId = "peer-1";
        int grpcPort = 50061;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--peer-id", "-n" -> {
                    ensureValue(args, i);
                    peerId = args[++i];
                }

                case "--grpc-port", "-g" -> {
                    ensureValue(args, i);
                    try {
                        grpcPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid grpc-port: " + args[i]);
                        System.exit(1);
                    }
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new PeerConfig(peerId, grpcPort);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: chesslink-peer [options]

            Options:
              --peer-id,   -n   Peer identifier (default: peer-1)
              --grpc-port, -g   Replication port (default: 50061)
              --help,      -h   Show this help message
            """);
        System.exit(0);
    }
}
