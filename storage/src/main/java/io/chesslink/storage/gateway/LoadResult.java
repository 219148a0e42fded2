// file: storage/src/main/java/io/chesslink/storage/gateway/LoadResult.java
package io.chesslink.storage.gateway;

/**
 * Outcome of {@link PersistenceGateway#load(String)}.
 * <p>
 * Exactly one of three shapes:
 *  - found:     payload != null, found == true,  error == null
 *  - not found: payload == null, found == false, error == null
 *  - failed:    payload == null, found == false, error != null
 */
public record LoadResult(String payload, boolean found, String error) {

    public static LoadResult found(String payload) {
        if (payload == null) {
            throw new IllegalArgumentException("found result needs a payload");
        }
        return new LoadResult(payload, true, null);
    }

    public static LoadResult notFound() {
        return new LoadResult(null, false, null);
    }

    public static LoadResult failed(String error) {
        return new LoadResult(null, false, error == null ? "unknown error" : error);
    }

    public boolean failed() {
        return error != null;
    }
}
