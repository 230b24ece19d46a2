package com.rebenew.listenParty.syncclient.sync;

import com.rebenew.listenParty.protocol.model.PlaybackSnapshot;
import com.rebenew.listenParty.protocol.model.PlaylistItem;
import com.rebenew.listenParty.syncclient.SyncOptions;
import com.rebenew.listenParty.syncclient.player.LocalPlayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Emisor de snapshots del master. Solo está activo mientras el usuario es owner en modo listen.
 * <p>
 * Eventos del reproductor, heartbeat y peticiones del servidor pasan todos por {@link #report()},
 * que es el único punto de emisión. Los eventos del reproductor llegan en su propio hilo y se
 * reenvían al ejecutor del cliente.
 */
public class PlaybackReporter implements LocalPlayer.Listener {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackReporter.class);

    private final LocalPlayer player;
    private final Consumer<PlaybackSnapshot> sink;
    private final SyncOptions options;
    private final ScheduledExecutorService scheduler;

    private boolean active;
    private String lastReportedSongId;
    private ScheduledFuture<?> heartbeat;

    public PlaybackReporter(LocalPlayer player, Consumer<PlaybackSnapshot> sink, SyncOptions options,
            ScheduledExecutorService scheduler) {
        this.player = player;
        this.sink = sink;
        this.options = options;
        this.scheduler = scheduler;
    }

    public synchronized void setActive(boolean active) {
        if (this.active == active) {
            return;
        }
        this.active = active;
        if (active) {
            logger.info("🎧 Reporter activo: este cliente es el master");
            heartbeat = scheduler.scheduleAtFixedRate(this::heartbeatTick, options.getHeartbeatIntervalMs(),
                    options.getHeartbeatIntervalMs(), TimeUnit.MILLISECONDS);
            report();
        } else {
            logger.info("🎧 Reporter inactivo");
            if (heartbeat != null) {
                heartbeat.cancel(false);
                heartbeat = null;
            }
            lastReportedSongId = null;
        }
    }

    public synchronized boolean isActive() {
        return active;
    }

    @Override
    public void onPlay() {
        reportOnLoop();
    }

    @Override
    public void onPause() {
        reportOnLoop();
    }

    @Override
    public void onSeeked(double positionSeconds) {
        reportOnLoop();
    }

    @Override
    public void onTrackChanged(String songId) {
        reportOnLoop();
    }

    /**
     * El servidor pidió el estado actual (un seguidor acaba de entrar).
     */
    public void onMasterRequest() {
        report();
    }

    private void reportOnLoop() {
        try {
            scheduler.execute(this::report);
        } catch (RejectedExecutionException e) {
            logger.debug("Player event dropped: client closed");
        }
    }

    void heartbeatTick() {
        if (player.isPlaying()) {
            report();
        }
    }

    /**
     * @return el snapshot emitido, o null si no había nada que reportar
     */
    public synchronized PlaybackSnapshot report() {
        if (!active) {
            return null;
        }
        PlaylistItem item = player.currentItem();
        if (item == null) {
            return null;
        }

        double position = player.positionSeconds();
        if (lastReportedSongId != null && !lastReportedSongId.equals(item.songId())) {
            // cambio de canción: la nueva siempre arranca en 0
            position = 0;
        }
        PlaybackSnapshot snapshot = PlaybackSnapshot.fromItem(item, Math.max(0, position), player.isPlaying());
        lastReportedSongId = item.songId();
        sink.accept(snapshot);
        logger.debug("📤 Report {}", snapshot);
        return snapshot;
    }
}
