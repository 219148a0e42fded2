// file: server/src/main/java/io/chesslink/server/HostMain.java
package io.chesslink.server;

import io.chesslink.core.InMemoryBoard;
import io.chesslink.core.Square;
import io.chesslink.server.autosave.AutoSaveScheduler;
import io.chesslink.server.replication.GrpcPeerLink;
import io.chesslink.server.replication.PeersConfig;
import io.chesslink.server.replication.ReplicationChannel;
import io.chesslink.server.replication.SessionReplica;
import io.chesslink.server.session.OperationResult;
import io.chesslink.server.session.Outcome;
import io.chesslink.server.session.Phase;
import io.chesslink.server.session.SessionCoordinator;
import io.chesslink.server.session.SessionLoop;
import io.chesslink.server.session.SessionView;
import io.chesslink.storage.gateway.HttpPersistenceGateway;
import io.chesslink.storage.gateway.InMemoryPersistenceGateway;
import io.chesslink.storage.gateway.PersistenceGateway;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Entry point for the host node: owns the authoritative session.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire board, persistence gateway, replication channel, coordinator and auto-save.
 *  - Register configured peers over gRPC.
 *  - Run a line-based console driving the session.
 */
public final class HostMain {

    private final HostConfig cfg;
    private final SessionLoop loop;
    private final InMemoryBoard board;
    private final SessionCoordinator coordinator;
    private final AutoSaveScheduler autosave;
    private int halfMoves;

    HostMain(HostConfig cfg, SessionLoop loop, InMemoryBoard board,
                     SessionCoordinator coordinator, AutoSaveScheduler autosave) {
        this.cfg = cfg;
        this.loop = loop;
        this.board = board;
        this.coordinator = coordinator;
        this.autosave = autosave;
    }

    public static void main(String[] args) throws IOException {
        var cfg = HostConfig.fromArgs(args);

        var loop = new SessionLoop();
        var board = InMemoryBoard.standard();
        PersistenceGateway gateway = buildGateway(cfg);

        // ------ Replication ------
        var channel = new ReplicationChannel();
        var selfView = new SessionReplica(cfg.peerId());
        channel.addLocalListener(selfView::apply);

        var coordinator = new SessionCoordinator(cfg.peerId(), board, gateway, channel, loop.executor());
        var autosave = new AutoSaveScheduler(
                coordinator,
                loop.executor(),
                Duration.ofSeconds(cfg.autosaveIntervalSec()),
                cfg.autosaveEveryMoves(),
                cfg.autosave()
        );
        coordinator.addListener(autosave);

        PeersConfig peers = cfg.peersConfigPath() == null
                ? PeersConfig.empty()
                : PeersConfig.fromJsonFile(Path.of(cfg.peersConfigPath()));
        for (PeersConfig.Peer p : peers.peers()) {
            loop.call(() -> {
                coordinator.peerJoined(p.peerId(), new GrpcPeerLink(p.host(), p.grpcPort()));
                return null;
            }).join();
        }

        System.out.printf("Host %s ready (%d peers, store=%s, autosave=%s)%n",
                cfg.peerId(), peers.peers().size(),
                cfg.storeUrl() == null ? "in-memory" : cfg.storeUrl(),
                cfg.autosave() ? "on" : "off");

        var host = new HostMain(cfg, loop, board, coordinator, autosave);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            autosave.close();
            loop.call(() -> {
                channel.close();
                return null;
            }).join();
            loop.close();
        }));

        host.console();
    }

    private static PersistenceGateway buildGateway(HostConfig cfg) {
        if (cfg.storeUrl() == null || cfg.storeUrl().isBlank()) {
            return new InMemoryPersistenceGateway();
        }
        var http = new HttpPersistenceGateway(URI.create(cfg.storeUrl()), Duration.ofSeconds(5));
        if (!http.initialize().join()) {
            System.err.println("warning: document store " + cfg.storeUrl() + " not reachable yet; it is probed again before each save or load");
        }
        return http;
    }

    // ---------- console ----------

    private void console() throws IOException {
        printHelp();
        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line;
        while ((line = in.readLine()) != null) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length == 0 || parts[0].isEmpty()) {
                continue;
            }
            try {
                if (!dispatch(parts)) {
                    return;
                }
            } catch (IllegalArgumentException bad) {
                System.out.println("error: " + bad.getMessage());
            }
        }
    }

    private boolean dispatch(String[] parts) {
        switch (parts[0]) {
            case "start", "new" -> print(startGame());
            case "move" -> {
                if (parts.length != 3) {
                    System.out.println("usage: move <from> <to>");
                    return true;
                }
                print(playMove(Square.parse(parts[1]), Square.parse(parts[2])));
            }
            case "save" -> print(loop.compose(() -> coordinator.save(cfg.peerId())).join());
            case "load" -> {
                if (parts.length != 2) {
                    System.out.println("usage: load <sessionId>");
                    return true;
                }
                print(loop.compose(() -> coordinator.load(cfg.peerId(), parts[1])).join());
            }
            case "autosave" -> {
                if (parts.length != 2 || !(parts[1].equals("on") || parts[1].equals("off"))) {
                    System.out.println("usage: autosave on|off");
                    return true;
                }
                autosave.setEnabled(parts[1].equals("on"));
                System.out.println("autosave " + parts[1]);
            }
            case "status" -> {
                SessionView v = loop.call(coordinator::view).join();
                System.out.printf("session=%s phase=%s move=%d lastSaved=%d pieces=%d%n",
                        v.sessionId(), v.phase(), v.halfMoveIndex(), v.lastSavedMoveIndex(), v.snapshot().size());
            }
            case "end" -> print(onLoop(() -> coordinator.endSession(cfg.peerId())));
            case "quit", "exit" -> {
                return false;
            }
            case "help" -> printHelp();
            default -> System.out.println("unknown command: " + parts[0] + " (try 'help')");
        }
        return true;
    }

    OperationResult startGame() {
        return onLoop(() -> {
            OperationResult r = coordinator.startSession(cfg.peerId());
            if (r.isOk()) {
                halfMoves = 0;
            }
            return r;
        });
    }

    /**
     * Move a piece and record it. The board is left alone unless a session is
     * live and no load is about to replace it.
     *
     * @throws IllegalArgumentException if {@code from} is empty
     */
    OperationResult playMove(Square from, Square to) {
        return onLoop(() -> {
            Phase phase = coordinator.phase();
            if (!phase.isLive()) {
                return OperationResult.rejected(Outcome.SESSION_NOT_ACTIVE, coordinator.currentSessionId(),
                        "no live session; use 'start' first");
            }
            if (phase == Phase.LOADING) {
                return OperationResult.rejected(Outcome.OPERATION_IN_PROGRESS, coordinator.currentSessionId(),
                        "a load is replacing the board");
            }
            board.move(from, to);
            OperationResult r = coordinator.recordMove(cfg.peerId(), halfMoves + 1);
            if (r.isOk()) {
                halfMoves++;
            }
            return r;
        });
    }

    int halfMoves() {
        return loop.call(() -> halfMoves).join();
    }

    private OperationResult onLoop(Supplier<OperationResult> task) {
        try {
            return loop.call(task).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }

    private static void print(OperationResult r) {
        System.out.println(r.outcome() + (r.sessionId() == null ? "" : " [" + r.sessionId() + "]") + " " + r.message());
    }

    private static void printHelp() {
        System.out.println("""
            Commands:
              start | new          start a session (new game if one is live)
              move <from> <to>     move a piece, e.g. move e2 e4
              save                 save the current game
              load <sessionId>     load a saved game
              autosave on|off      toggle auto-save
              status               show session state
              end                  end the session
              quit                 exit
            """);
    }
}
