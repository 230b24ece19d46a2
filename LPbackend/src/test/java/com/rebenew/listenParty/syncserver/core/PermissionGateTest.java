package com.rebenew.listenParty.syncserver.core;

import com.rebenew.listenParty.protocol.error.ErrorCode;
import com.rebenew.listenParty.protocol.error.RoomException;
import com.rebenew.listenParty.protocol.model.MemberMode;
import com.rebenew.listenParty.protocol.model.MemberRole;
import com.rebenew.listenParty.syncserver.model.Member;
import com.rebenew.listenParty.syncserver.model.RoomOperation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatCode;

class PermissionGateTest {

    private static Member member(String id, MemberRole role) {
        return new Member(id, id, null, role, 1L, 1L);
    }

    @Test
    void onlyOwnerCanDisbandGrantAndTransfer() {
        Member owner = member("owner", MemberRole.OWNER);
        Member admin = member("admin", MemberRole.ADMIN);
        Member granted = member("m1", MemberRole.MEMBER);
        granted.setCanControl(true);

        for (RoomOperation op : new RoomOperation[] { RoomOperation.DISBAND, RoomOperation.GRANT_CONTROL,
                RoomOperation.TRANSFER_OWNER }) {
            assertThat(PermissionGate.canPerform(owner, op)).as(op.name()).isTrue();
            assertThat(PermissionGate.canPerform(admin, op)).as(op.name()).isFalse();
            assertThat(PermissionGate.canPerform(granted, op)).as(op.name()).isFalse();
        }
    }

    @ParameterizedTest
    @EnumSource(value = RoomOperation.class, names = { "ADD_SONG", "REMOVE_SONG", "REORDER_SONG", "PLAY", "PAUSE",
            "SEEK", "NEXT", "PREV" })
    void playlistAndPlaybackControlFollowRoleOrGrant(RoomOperation op) {
        Member plain = member("m1", MemberRole.MEMBER);
        Member granted = member("m2", MemberRole.MEMBER);
        granted.setCanControl(true);

        assertThat(PermissionGate.canPerform(member("o", MemberRole.OWNER), op)).isTrue();
        assertThat(PermissionGate.canPerform(member("a", MemberRole.ADMIN), op)).isTrue();
        assertThat(PermissionGate.canPerform(granted, op)).isTrue();
        assertThat(PermissionGate.canPerform(plain, op)).isFalse();
    }

    @Test
    void anyMemberCanSetOwnMode() {
        assertThat(PermissionGate.canPerform(member("m1", MemberRole.MEMBER), RoomOperation.SET_MODE)).isTrue();
    }

    @Test
    void onlyOwnerInListenModeIsMaster() {
        Member owner = member("owner", MemberRole.OWNER);
        Member listener = member("m1", MemberRole.MEMBER);
        listener.setMode(MemberMode.LISTEN);

        assertThat(PermissionGate.isMaster(owner)).isFalse();
        assertThat(PermissionGate.canPerform(listener, RoomOperation.REPORT_PLAYBACK)).isFalse();

        owner.setMode(MemberMode.LISTEN);
        assertThat(PermissionGate.isMaster(owner)).isTrue();
        assertThat(PermissionGate.canPerform(owner, RoomOperation.REPORT_PLAYBACK)).isTrue();
    }

    @Test
    void checkReportsNotMasterForPlaybackReports() {
        Member owner = member("owner", MemberRole.OWNER);

        assertThatThrownBy(() -> PermissionGate.check(owner, RoomOperation.REPORT_PLAYBACK))
                .isInstanceOf(RoomException.class)
                .extracting(e -> ((RoomException) e).getErrorCode())
                .isEqualTo(ErrorCode.NOT_MASTER);
    }

    @Test
    void checkReportsPermissionDeniedForNonMembers() {
        assertThatThrownBy(() -> PermissionGate.check(null, RoomOperation.ADD_SONG))
                .isInstanceOf(RoomException.class)
                .extracting(e -> ((RoomException) e).getErrorCode())
                .isEqualTo(ErrorCode.PERMISSION_DENIED);
        assertThatCode(() -> PermissionGate.check(member("o", MemberRole.OWNER), RoomOperation.ADD_SONG))
                .doesNotThrowAnyException();
    }

    @Test
    void grantAndTransferTargets() {
        Member owner = member("owner", MemberRole.OWNER);
        Member other = member("m1", MemberRole.MEMBER);

        assertThat(PermissionGate.canGrantControlTo(owner, other)).isTrue();
        assertThat(PermissionGate.canGrantControlTo(owner, owner)).isFalse();
        assertThat(PermissionGate.canTransferOwnerTo(owner, other)).isTrue();
        assertThat(PermissionGate.canTransferOwnerTo(owner, owner)).isFalse();
    }
}
