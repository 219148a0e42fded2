// file: core/src/main/java/io/chesslink/core/SessionIds.java
package io.chesslink.core;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Session identifier helpers.
 * <p>
 * Generated ids are the first 8 hex characters of a random UUID. Ids coming
 * from outside (a load request, an HTTP path) are only required to match
 * {@code [A-Za-z0-9_-]{1,64}} so that records written by other tools stay
 * loadable.
 */
public final class SessionIds {
    private static final Pattern EXTERNAL = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private SessionIds() {
        // utility
    }

    public static String generate() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean isValid(String id) {
        return id != null && EXTERNAL.matcher(id).matches();
    }

    /**
     * @throws IllegalArgumentException if {@code id} is null, blank or has
     *                                  characters outside {@code [A-Za-z0-9_-]}
     */
    public static String requireValid(String id) {
        if (!isValid(id)) {
            throw new IllegalArgumentException("invalid session id: '" + id + "'");
        }
        return id;
    }
}
