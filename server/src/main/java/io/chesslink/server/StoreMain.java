// file: server/src/main/java/io/chesslink/server/StoreMain.java
package io.chesslink.server;

import io.chesslink.server.store.StoreServer;
import io.chesslink.storage.FileRecordStore;

import java.nio.file.Path;

/**
 * Entry point for the document store server.
 */
public final class StoreMain {

    private StoreMain() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = StoreConfig.fromArgs(args);

        var records = new FileRecordStore(Path.of(cfg.dataDir()));
        var web = new StoreServer(cfg.httpPort(), records);
        web.start();

        System.out.printf("Document store listening on http://localhost:%d (data in %s)%n",
                cfg.httpPort(), cfg.dataDir());

        Runtime.getRuntime().addShutdownHook(new Thread(web::stop));
    }
}
