package com.rebenew.listenParty.syncclient.player;

import com.rebenew.listenParty.protocol.model.PlaylistItem;

import java.util.concurrent.CompletableFuture;

/**
 * Reproductor local del cliente. El motor solo lo manipula a través de esta interfaz.
 */
public interface LocalPlayer {

    String currentSongId();

    /**
     * Canción cargada, o null si no hay ninguna.
     */
    PlaylistItem currentItem();

    double positionSeconds();

    boolean isPlaying();

    /**
     * Carga la pista; el future se completa cuando está lista para seek/play.
     */
    CompletableFuture<Void> load(String hlsUrl, String songId);

    /**
     * Carga una canción de la playlist (usado por el master al aplicar comandos).
     */
    default CompletableFuture<Void> load(PlaylistItem item) {
        return load(item.hlsUrl(), item.songId());
    }

    void seek(double positionSeconds);

    void play();

    void pause();

    void addListener(Listener listener);

    void removeListener(Listener listener);

    interface Listener {
        default void onPlay() {
        }

        default void onPause() {
        }

        default void onSeeked(double positionSeconds) {
        }

        default void onTrackChanged(String songId) {
        }
    }
}
