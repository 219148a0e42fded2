// file: server/src/main/java/io/chesslink/server/replication/DeliveryReceipt.java
package io.chesslink.server.replication;

/**
 * Peer's answer to one delivered message.
 *
 * @param applied         false when the peer already had the message
 * @param resyncRequested true when the peer noticed missing messages and wants a catch-up
 */
public record DeliveryReceipt(boolean applied, boolean resyncRequested) {

    public static final DeliveryReceipt APPLIED = new DeliveryReceipt(true, false);

    public static DeliveryReceipt of(ApplyResult result) {
        return new DeliveryReceipt(result.applied(), result == ApplyResult.APPLIED_AFTER_GAP);
    }
}
