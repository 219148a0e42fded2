// file: server/src/main/java/io/chesslink/server/dto/SaveResponse.java
package io.chesslink.server.dto;

/** Body of a successful PUT /games/{sessionId}. */
public class SaveResponse {
    public boolean ok;
    public String sessionId;
    public long timestamp;
}
