package com.rebenew.listenParty.syncclient.sync;

import com.rebenew.listenParty.protocol.model.PlaybackSnapshot;
import com.rebenew.listenParty.syncclient.SyncOptions;
import com.rebenew.listenParty.syncclient.player.LocalPlayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Lleva el reproductor local de un seguidor al estado del master.
 * <p>
 * IDLE → SYNCING al recibir un snapshot → SYNCED cuando el reproductor quedó alineado.
 * Solo los snapshots entrantes mueven el estado; salir del modo listen vuelve a IDLE.
 */
public class FollowerSynchronizer {
    private static final Logger logger = LoggerFactory.getLogger(FollowerSynchronizer.class);

    public enum State {
        IDLE, SYNCING, SYNCED
    }

    private final LocalPlayer player;
    private final SyncOptions options;
    private final Clock clock;
    // las cargas del reproductor completan en su propio hilo; el resultado se aplica aquí
    private final Executor callbackExecutor;

    private boolean enabled;
    private State state = State.IDLE;
    // cada carga de pista lleva la generación vigente; una carga de una generación anterior se descarta
    private long generation;
    private String loadingSongId;
    private PlaybackSnapshot pendingTarget;

    public FollowerSynchronizer(LocalPlayer player, SyncOptions options, Clock clock, Executor callbackExecutor) {
        this.player = player;
        this.options = options;
        this.clock = clock;
        this.callbackExecutor = callbackExecutor;
    }

    public synchronized void start() {
        enabled = true;
    }

    public synchronized void stop() {
        enabled = false;
        state = State.IDLE;
        generation++;
        loadingSongId = null;
        pendingTarget = null;
    }

    public synchronized boolean isEnabled() {
        return enabled;
    }

    public synchronized State getState() {
        return state;
    }

    /**
     * @param viewerIsOwner el owner nunca se reconcilia contra sí mismo
     */
    public synchronized void onSnapshot(PlaybackSnapshot snapshot, boolean viewerIsOwner) {
        if (!enabled || snapshot == null || snapshot.getSongId() == null || viewerIsOwner) {
            return;
        }
        state = State.SYNCING;

        if (snapshot.getSongId().equals(loadingSongId)) {
            // la pista ya se está cargando: al terminar se aplicará el snapshot más reciente
            pendingTarget = snapshot;
            return;
        }

        if (!snapshot.getSongId().equals(player.currentSongId())) {
            startLoad(snapshot);
            return;
        }

        // una carga anterior de otra pista queda obsoleta
        if (loadingSongId != null) {
            generation++;
            loadingSongId = null;
            pendingTarget = null;
        }
        reconcileSameTrack(snapshot);
        state = State.SYNCED;
    }

    private void startLoad(PlaybackSnapshot snapshot) {
        long loadGeneration = ++generation;
        loadingSongId = snapshot.getSongId();
        pendingTarget = snapshot;
        logger.debug("🎵 Loading {} for sync (generation {})", snapshot.getSongId(), loadGeneration);
        player.load(snapshot.getHlsUrl(), snapshot.getSongId())
                .whenCompleteAsync((ignored, ex) -> onLoaded(loadGeneration, ex), callbackExecutor);
    }

    private synchronized void onLoaded(long loadGeneration, Throwable ex) {
        if (loadGeneration != generation || !enabled) {
            logger.debug("Stale load (generation {}, current {}) discarded", loadGeneration, generation);
            return;
        }
        PlaybackSnapshot target = pendingTarget;
        loadingSongId = null;
        pendingTarget = null;
        if (ex != null) {
            logger.warn("⚠️ No se pudo cargar la pista {}: {}", target != null ? target.getSongId() : null,
                    ex.getMessage());
            return;
        }
        if (target == null) {
            return;
        }

        player.seek(targetPosition(target));
        if (target.isPlaying()) {
            player.play();
        } else {
            player.pause();
        }
        state = State.SYNCED;
    }

    private void reconcileSameTrack(PlaybackSnapshot snapshot) {
        if (player.isPlaying() != snapshot.isPlaying()) {
            if (snapshot.isPlaying()) {
                player.play();
            } else {
                player.pause();
            }
        }
        double target = targetPosition(snapshot);
        double drift = Math.abs(player.positionSeconds() - target);
        if (drift > options.getDriftThresholdSeconds()) {
            logger.debug("⏩ Drift {}s > {}s, seeking to {}", drift, options.getDriftThresholdSeconds(), target);
            player.seek(target);
        }
    }

    double targetPosition(PlaybackSnapshot snapshot) {
        double position = snapshot.getPositionSeconds();
        if (options.isExtrapolatePosition() && snapshot.isPlaying() && snapshot.getReportedAt() > 0) {
            long elapsedMs = clock.millis() - snapshot.getReportedAt();
            if (elapsedMs > 0) {
                position += elapsedMs / 1000.0;
            }
        }
        return position;
    }
}
