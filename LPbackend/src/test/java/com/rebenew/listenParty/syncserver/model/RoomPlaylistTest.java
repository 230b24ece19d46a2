package com.rebenew.listenParty.syncserver.model;

import com.rebenew.listenParty.protocol.error.ErrorCode;
import com.rebenew.listenParty.protocol.error.RoomException;
import com.rebenew.listenParty.protocol.model.PlaylistItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomPlaylistTest {

    private RoomPlaylist playlist;

    @BeforeEach
    void setUp() {
        playlist = new RoomPlaylist();
    }

    private static PlaylistItem song(String id) {
        return new PlaylistItem("netease_" + id, "Song " + id, "Artist", null, 200, null, 0, null, 0L);
    }

    private List<String> ids() {
        return playlist.getItems().stream().map(PlaylistItem::songId).collect(Collectors.toList());
    }

    private void assertContiguous() {
        List<PlaylistItem> items = playlist.getItems();
        for (int i = 0; i < items.size(); i++) {
            assertThat(items.get(i).position()).as("position of " + items.get(i).songId()).isEqualTo(i);
        }
    }

    @Test
    void addAppendsAtEndAndStampsAuthor() {
        PlaylistItem a = playlist.add(song("A"), "u1", 1000L);
        PlaylistItem b = playlist.add(song("B"), "u2", 2000L);

        assertThat(a.position()).isZero();
        assertThat(b.position()).isEqualTo(1);
        assertThat(b.addedBy()).isEqualTo("u2");
        assertThat(b.addedAt()).isEqualTo(2000L);
    }

    @Test
    void addRejectsDuplicateSong() {
        playlist.add(song("A"), "u1", 1L);

        assertThatThrownBy(() -> playlist.add(song("A"), "u2", 2L))
                .isInstanceOf(RoomException.class)
                .extracting(e -> ((RoomException) e).getErrorCode())
                .isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(playlist.size()).isEqualTo(1);
    }

    @Test
    void removeMiddleRenumbersFollowingSongs() {
        playlist.add(song("A"), "u1", 1L);
        playlist.add(song("B"), "u1", 2L);
        playlist.add(song("C"), "u1", 3L);

        PlaylistItem removed = playlist.remove(1);

        assertThat(removed.songId()).isEqualTo("netease_B");
        assertThat(ids()).containsExactly("netease_A", "netease_C");
        assertThat(playlist.get(1).position()).isEqualTo(1);
        assertContiguous();
    }

    @Test
    void removeOutOfRangeLeavesPlaylistUntouched() {
        playlist.add(song("A"), "u1", 1L);

        assertThatThrownBy(() -> playlist.remove(1))
                .isInstanceOf(RoomException.class)
                .extracting(e -> ((RoomException) e).getErrorCode())
                .isEqualTo(ErrorCode.OUT_OF_RANGE);
        assertThatThrownBy(() -> playlist.remove(-1)).isInstanceOf(RoomException.class);
        assertThat(ids()).containsExactly("netease_A");
    }

    @Test
    void reorderMovesSingleSongInBothDirections() {
        for (String id : new String[] { "A", "B", "C", "D" }) {
            playlist.add(song(id), "u1", 1L);
        }

        playlist.reorder(0, 2);
        assertThat(ids()).containsExactly("netease_B", "netease_C", "netease_A", "netease_D");
        assertContiguous();

        playlist.reorder(3, 0);
        assertThat(ids()).containsExactly("netease_D", "netease_B", "netease_C", "netease_A");
        assertContiguous();
    }

    @Test
    void reorderRejectsInvalidIndex() {
        playlist.add(song("A"), "u1", 1L);
        playlist.add(song("B"), "u1", 1L);

        assertThatThrownBy(() -> playlist.reorder(0, 2))
                .isInstanceOf(RoomException.class)
                .extracting(e -> ((RoomException) e).getErrorCode())
                .isEqualTo(ErrorCode.OUT_OF_RANGE);
        assertThat(ids()).containsExactly("netease_A", "netease_B");
    }

    @Test
    void positionsStayContiguousAfterRandomEdits() {
        Random random = new Random(42);
        int next = 0;
        for (int step = 0; step < 300; step++) {
            int size = playlist.size();
            int action = random.nextInt(3);
            if (action == 0 || size == 0) {
                playlist.add(song("S" + next++), "u1", 1L);
            } else if (action == 1) {
                playlist.remove(random.nextInt(size));
            } else {
                playlist.reorder(random.nextInt(size), random.nextInt(size));
            }
            assertContiguous();
        }
    }
}
