package com.rebenew.listenParty.syncserver.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.rebenew.listenParty.protocol.MessageTypes;
import com.rebenew.listenParty.protocol.SyncMsg;
import com.rebenew.listenParty.protocol.error.ErrorCode;
import com.rebenew.listenParty.protocol.model.PlaylistItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlaylistServiceTest extends RoomServiceTestSupport {

    private List<PlaylistItem> lastBroadcast(String userId) {
        List<SyncMsg> updates = received(userId, MessageTypes.PLAYLIST, MessageTypes.PLAYLIST_UPDATE);
        assertThat(updates).isNotEmpty();
        return objectMapper.convertValue(updates.get(updates.size() - 1).getDataAsMap().get("items"),
                new TypeReference<List<PlaylistItem>>() {
                });
    }

    @Test
    void addThenRemoveMiddleBroadcastsRenumberedPlaylist() {
        String roomId = createRoom();
        connect(roomId, "owner");
        connect(roomId, "u1");
        playlistService.addSong(roomId, "owner", song("A")).join();
        playlistService.addSong(roomId, "owner", song("B")).join();
        playlistService.addSong(roomId, "owner", song("C")).join();
        clearAll();

        playlistService.removeSong(roomId, "owner", 1).join();

        List<PlaylistItem> items = lastBroadcast("u1");
        assertThat(items).extracting(PlaylistItem::songId).containsExactly("netease_A", "netease_C");
        assertThat(items).extracting(PlaylistItem::position).containsExactly(0, 1);
        assertThat(items.get(0).addedBy()).isEqualTo("owner");
    }

    @Test
    void reorderBroadcastsFullPlaylist() {
        String roomId = createRoom();
        connect(roomId, "owner");
        playlistService.addSong(roomId, "owner", song("A")).join();
        playlistService.addSong(roomId, "owner", song("B")).join();
        playlistService.addSong(roomId, "owner", song("C")).join();
        clearAll();

        playlistService.reorderSong(roomId, "owner", 2, 0).join();

        assertThat(lastBroadcast("owner")).extracting(PlaylistItem::songId)
                .containsExactly("netease_C", "netease_A", "netease_B");
    }

    @Test
    void deniedEditChangesNothingAndBroadcastsNothing() {
        String roomId = createRoom();
        connect(roomId, "owner");
        connect(roomId, "u1");
        playlistService.addSong(roomId, "owner", song("A")).join();
        clearAll();

        assertThat(errorOf(playlistService.addSong(roomId, "u1", song("B")))).isEqualTo(ErrorCode.PERMISSION_DENIED);
        assertThat(errorOf(playlistService.removeSong(roomId, "u1", 0))).isEqualTo(ErrorCode.PERMISSION_DENIED);
        assertThat(errorOf(playlistService.reorderSong(roomId, "stranger", 0, 0)))
                .isEqualTo(ErrorCode.PERMISSION_DENIED);

        assertThat(playlistService.getPlaylist(roomId, "u1").join()).extracting(PlaylistItem::songId)
                .containsExactly("netease_A");
        assertThat(errorOf(playlistService.getPlaylist(roomId, "stranger"))).isEqualTo(ErrorCode.PERMISSION_DENIED);
        assertThat(received("owner")).isEmpty();
        assertThat(received("u1")).isEmpty();
    }

    @Test
    void grantedMemberCanEdit() {
        String roomId = createRoom();
        connect(roomId, "owner");
        connect(roomId, "u1");
        grant(roomId, "u1");

        PlaylistItem added = playlistService.addSong(roomId, "u1", song("Z")).join();

        assertThat(added.position()).isZero();
        assertThat(added.addedBy()).isEqualTo("u1");
    }

    @Test
    void invalidEditsFailWithoutBroadcast() {
        String roomId = createRoom();
        connect(roomId, "owner");
        playlistService.addSong(roomId, "owner", song("A")).join();
        clearAll();

        assertThat(errorOf(playlistService.addSong(roomId, "owner", song("A")))).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(errorOf(playlistService.removeSong(roomId, "owner", 3))).isEqualTo(ErrorCode.OUT_OF_RANGE);
        assertThat(errorOf(playlistService.reorderSong(roomId, "owner", 0, 1))).isEqualTo(ErrorCode.OUT_OF_RANGE);
        assertThat(received("owner")).isEmpty();
    }
}
