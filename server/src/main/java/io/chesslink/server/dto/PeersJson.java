// file: server/src/main/java/io/chesslink/server/dto/PeersJson.java
package io.chesslink.server.dto;

import java.util.List;

/** Jackson shape of the peers config file. */
public class PeersJson {
    public List<PeerJson> peers;

    public static class PeerJson {
        public String peerId;
        public String host = "localhost";
        public int grpcPort;
    }
}
