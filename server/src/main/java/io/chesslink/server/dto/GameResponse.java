// file: server/src/main/java/io/chesslink/server/dto/GameResponse.java
package io.chesslink.server.dto;

import com.fasterxml.jackson.databind.JsonNode;

/** Body of a successful GET /games/{sessionId}. */
public class GameResponse {
    public String sessionId;
    public long timestamp;
    public JsonNode state;
}
