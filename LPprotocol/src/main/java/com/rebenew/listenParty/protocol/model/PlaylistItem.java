package com.rebenew.listenParty.protocol.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rebenew.listenParty.protocol.error.RoomException;

/**
 * Canción en la playlist compartida de una sala.
 * La posición es un rango denso 0..n-1 mantenido por el servidor.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlaylistItem(
        String songId,
        String name,
        String artist,
        String cover,
        int duration, // segundos
        SongSource source,
        int position,
        String addedBy,
        long addedAt
) {
    public PlaylistItem {
        if (songId == null || songId.trim().isEmpty()) {
            throw RoomException.validation("songId no puede ser nulo o vacío");
        }
        if (name == null || name.trim().isEmpty()) {
            throw RoomException.validation("name no puede ser nulo o vacío");
        }
        if (source == null) {
            SongSource inferred = SongSource.fromSongId(songId);
            source = inferred != null ? inferred : SongSource.NETEASE;
        }
        if (duration < 0) {
            duration = 0;
        }
        if (addedAt <= 0) {
            addedAt = System.currentTimeMillis();
        }
    }

    public PlaylistItem withPosition(int newPosition) {
        return new PlaylistItem(songId, name, artist, cover, duration, source, newPosition, addedBy, addedAt);
    }

    public PlaylistItem withAddedBy(String userId, long at) {
        return new PlaylistItem(songId, name, artist, cover, duration, source, position, userId, at);
    }

    /**
     * Ruta HLS del segmento de audio, servida por un componente externo.
     */
    public String hlsUrl() {
        return "/streams/" + source.getValue() + "/" + songId + "/playlist.m3u8";
    }
}
