// file: server/src/main/java/io/chesslink/server/replication/PeersConfig.java
package io.chesslink.server.replication;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chesslink.server.dto.PeersJson;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static list of peers the host replicates to, loaded from JSON:
 * <pre>
 * { "peers": [ { "peerId": "peer-1", "host": "localhost", "grpcPort": 50061 } ] }
 * </pre>
 */
public record PeersConfig(List<Peer> peers) {

    public record Peer(String peerId, String host, int grpcPort) {
        public Peer {
            Objects.requireNonNull(peerId, "peerId");
            Objects.requireNonNull(host, "host");
            if (peerId.isBlank()) throw new IllegalArgumentException("peerId must not be blank");
            if (grpcPort <= 0 || grpcPort > 65535) throw new IllegalArgumentException("grpcPort out of range");
        }
    }

    public PeersConfig {
        peers = List.copyOf(Objects.requireNonNull(peers, "peers"));
        Set<String> ids = new HashSet<>();
        for (Peer p : peers) {
            if (!ids.add(p.peerId())) {
                throw new IllegalArgumentException("duplicate peerId: " + p.peerId());
            }
        }
    }

    public static PeersConfig empty() {
        return new PeersConfig(List.of());
    }

    public static PeersConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            PeersJson cfg = mapper.readValue(path.toFile(), PeersJson.class);
            if (cfg.peers == null) {
                return empty();
            }
            return new PeersConfig(cfg.peers.stream()
                    .map(p -> new Peer(p.peerId, p.host, p.grpcPort))
                    .toList());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load PeersConfig from " + path, e);
        }
    }
}
