package com.rebenew.listenParty.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Estado de reproducción del master en un instante.
 * El servidor sella reportedAt, masterId y masterName al aceptarlo.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlaybackSnapshot {
    private String songId;
    private String songName;
    private String artist;
    private String cover;
    private long durationMs;
    private double positionSeconds;
    @JsonProperty("isPlaying")
    private boolean playing;
    private String hlsUrl;
    private long reportedAt;
    private String masterId;
    private String masterName;

    public static PlaybackSnapshot fromItem(PlaylistItem item, double positionSeconds, boolean playing) {
        return PlaybackSnapshot.builder()
                .songId(item.songId())
                .songName(item.name())
                .artist(item.artist())
                .cover(item.cover())
                .durationMs(item.duration() * 1000L)
                .positionSeconds(positionSeconds)
                .playing(playing)
                .hlsUrl(item.hlsUrl())
                .build();
    }

    @Override
    public String toString() {
        return String.format("PlaybackSnapshot{songId='%s', position=%.2f, playing=%s, reportedAt=%d}",
                songId, positionSeconds, playing, reportedAt);
    }
}
