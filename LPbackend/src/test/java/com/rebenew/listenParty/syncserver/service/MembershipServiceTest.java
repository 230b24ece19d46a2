package com.rebenew.listenParty.syncserver.service;

import com.rebenew.listenParty.protocol.MessageTypes;
import com.rebenew.listenParty.protocol.SyncMsg;
import com.rebenew.listenParty.protocol.error.ErrorCode;
import com.rebenew.listenParty.protocol.model.ChatMessageType;
import com.rebenew.listenParty.protocol.model.MemberMode;
import com.rebenew.listenParty.protocol.model.MemberRole;
import com.rebenew.listenParty.syncserver.config.RoomProperties;
import com.rebenew.listenParty.syncserver.model.Member;
import com.rebenew.listenParty.syncserver.model.RoomSession;
import com.rebenew.listenParty.syncserver.model.RoomStateResponse;
import com.rebenew.listenParty.syncserver.model.UserRoomInfo;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

class MembershipServiceTest extends RoomServiceTestSupport {

    @Test
    void createRoomAssignsSixDigitIdAndOwner() {
        String roomId = createRoom();

        assertThat(roomId).matches("\\d{6}");
        RoomSession room = manager.requireSession(roomId);
        assertThat(room.getOwnerId()).isEqualTo("owner");
        assertThat(room.getMember("owner").getRole()).isEqualTo(MemberRole.OWNER);
        assertThat(room.getMember("owner").getMode()).isEqualTo(MemberMode.CHAT);
    }

    @Test
    void joinAddsMemberWithDefaultsAndAnnouncesIt() {
        String roomId = createRoom();
        connect(roomId, "owner");
        clearAll();

        RoomStateResponse state = membershipService.join(roomId, "u1", "Ana", null).join();

        assertThat(state.getYou().getRole()).isEqualTo(MemberRole.MEMBER);
        assertThat(state.getYou().getMode()).isEqualTo(MemberMode.CHAT);
        assertThat(state.getYou().isCanControl()).isFalse();
        assertThat(state.getMembers()).hasSize(2);
        assertThat(received("owner", MessageTypes.MEMBER, MessageTypes.MEMBER_JOIN)).hasSize(1);
        assertThat(received("owner", MessageTypes.MEMBER_LIST, null)).isNotEmpty();
        assertThat(savedMessages).anySatisfy(message -> {
            assertThat(message.getMessageType()).isEqualTo(ChatMessageType.SYSTEM);
            assertThat(message.getContent()).contains("Ana");
        });
    }

    @Test
    void rejoinKeepsRoleAndGrant() {
        String roomId = createRoom();
        membershipService.join(roomId, "u1", "Ana", null).join();
        grant(roomId, "u1");

        RoomStateResponse state = membershipService.join(roomId, "u1", "Ana", null).join();

        assertThat(state.getYou().isCanControl()).isTrue();
        assertThat(state.getMembers()).hasSize(2);
    }

    @Test
    void joinPastCapacityFails() {
        properties.setMaxMembers(2);
        String roomId = createRoom();
        membershipService.join(roomId, "u1", "Ana", null).join();

        assertThat(errorOf(membershipService.join(roomId, "u2", "Bea", null))).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(manager.requireSession(roomId).getMemberCount()).isEqualTo(2);
    }

    @Test
    void malformedOrUnknownRoomIdsAreRejected() {
        assertThat(errorOf(membershipService.join("12ab", "u1", "Ana", null))).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(errorOf(membershipService.join("000001", "u1", "Ana", null))).isEqualTo(ErrorCode.ROOM_NOT_FOUND);
    }

    @Test
    void ownerLeavingListenForcesFollowersToChat() {
        String roomId = createRoom();
        connect(roomId, "owner");
        connect(roomId, "f1");
        connect(roomId, "f2");
        connect(roomId, "c1");
        listen(roomId, "owner");
        listen(roomId, "f1");
        listen(roomId, "f2");
        clearAll();

        membershipService.setMode(roomId, "owner", MemberMode.CHAT).join();

        RoomSession room = manager.requireSession(roomId);
        assertThat(room.getMember("f1").getMode()).isEqualTo(MemberMode.CHAT);
        assertThat(room.getMember("f2").getMode()).isEqualTo(MemberMode.CHAT);
        assertThat(room.getMaster()).isNull();

        List<SyncMsg> modeChanges = received("c1", MessageTypes.MODE, MessageTypes.MODE_SET);
        assertThat(modeChanges).extracting(msg -> msg.getStringData("userId"))
                .containsExactlyInAnyOrder("owner", "f1", "f2");
        assertThat(modeChanges).allSatisfy(msg -> assertThat(msg.getStringData("mode")).isEqualTo("chat"));

        List<SyncMsg> masterMode = received("f1", MessageTypes.MODE, MessageTypes.MODE_MASTER_MODE);
        assertThat(masterMode).hasSize(1);
        assertThat(masterMode.get(0).getBoolData("active")).isFalse();
    }

    @Test
    void listenWithoutMasterIsAcceptedAndWaits() {
        String roomId = createRoom();
        connect(roomId, "owner");
        connect(roomId, "f1");
        clearAll();

        listen(roomId, "f1");

        assertThat(manager.requireSession(roomId).getMember("f1").getMode()).isEqualTo(MemberMode.LISTEN);
        assertThat(received("owner", MessageTypes.PLAYBACK, MessageTypes.PLAYBACK_MASTER_REQUEST)).isEmpty();
    }

    @Test
    void grantControlBroadcastsAndRejectsOwnerTarget() {
        String roomId = createRoom();
        connect(roomId, "owner");
        connect(roomId, "u1");
        clearAll();

        grant(roomId, "u1");

        assertThat(manager.requireSession(roomId).getMember("u1").isCanControl()).isTrue();
        List<SyncMsg> grants = received("u1", MessageTypes.MEMBER, MessageTypes.MEMBER_GRANT_CONTROL);
        assertThat(grants).hasSize(1);
        assertThat(grants.get(0).getBoolData("canControl")).isTrue();

        assertThat(errorOf(membershipService.grantControl(roomId, "owner", "owner", false)))
                .isEqualTo(ErrorCode.PERMISSION_DENIED);
        assertThat(errorOf(membershipService.grantControl(roomId, "u1", "owner", false)))
                .isEqualTo(ErrorCode.PERMISSION_DENIED);
    }

    @Test
    void transferOwnerSwapsRoles() {
        String roomId = createRoom();
        connect(roomId, "owner");
        connect(roomId, "u1");
        clearAll();

        membershipService.transferOwner(roomId, "owner", "u1").join();

        RoomSession room = manager.requireSession(roomId);
        Member previous = room.getMember("owner");
        Member next = room.getMember("u1");
        assertThat(room.getOwnerId()).isEqualTo("u1");
        assertThat(previous.getRole()).isEqualTo(MemberRole.MEMBER);
        assertThat(previous.isCanControl()).isFalse();
        assertThat(next.getRole()).isEqualTo(MemberRole.OWNER);
        assertThat(next.isCanControl()).isTrue();
        assertThat(received("owner", MessageTypes.MEMBER, MessageTypes.MEMBER_ROLE_UPDATE)).hasSize(2);

        assertThat(errorOf(membershipService.transferOwner(roomId, "u1", "u1"))).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(errorOf(membershipService.transferOwner(roomId, "owner", "u1")))
                .isEqualTo(ErrorCode.PERMISSION_DENIED);
    }

    @Test
    void transferFromListeningMasterToChatMemberSendsListenersToChat() {
        String roomId = createRoom();
        connect(roomId, "owner");
        connect(roomId, "u1");
        connect(roomId, "f1");
        listen(roomId, "owner");
        listen(roomId, "f1");
        clearAll();

        membershipService.transferOwner(roomId, "owner", "u1").join();

        RoomSession room = manager.requireSession(roomId);
        assertThat(room.getMaster()).isNull();
        assertThat(room.getMember("f1").getMode()).isEqualTo(MemberMode.CHAT);
        assertThat(room.getMember("owner").getMode()).isEqualTo(MemberMode.CHAT);
        assertThat(received("f1", MessageTypes.MODE, MessageTypes.MODE_SET))
                .extracting(msg -> msg.getStringData("userId"))
                .containsExactlyInAnyOrder("owner", "f1");
        List<SyncMsg> masterMode = received("f1", MessageTypes.MODE, MessageTypes.MODE_MASTER_MODE);
        assertThat(masterMode).singleElement()
                .satisfies(msg -> assertThat(msg.getBoolData("active", true)).isFalse());
    }

    @Test
    void transferToListeningMemberKeepsFollowersListening() {
        String roomId = createRoom();
        connect(roomId, "owner");
        connect(roomId, "u1");
        connect(roomId, "f1");
        listen(roomId, "owner");
        listen(roomId, "u1");
        listen(roomId, "f1");
        clearAll();

        membershipService.transferOwner(roomId, "owner", "u1").join();

        RoomSession room = manager.requireSession(roomId);
        assertThat(room.getMaster().getUserId()).isEqualTo("u1");
        assertThat(room.getMember("f1").getMode()).isEqualTo(MemberMode.LISTEN);
        assertThat(received("f1", MessageTypes.MODE, MessageTypes.MODE_SET)).isEmpty();
    }

    @Test
    void roomStateIsOnlyForMembers() {
        String roomId = createRoom();
        connect(roomId, "owner");
        connect(roomId, "u1");

        RoomStateResponse state = membershipService.getRoomState(roomId, "u1").join();

        assertThat(state.getMembers()).hasSize(2);
        assertThat(errorOf(membershipService.getRoomState(roomId, "stranger"))).isEqualTo(ErrorCode.PERMISSION_DENIED);
    }

    @Test
    void leaveRemovesMemberAndKeepsRoom() {
        String roomId = createRoom();
        connect(roomId, "owner");
        WebSocketSession ws = connect(roomId, "u1");
        clearAll();

        membershipService.leave(roomId, "u1").join();

        RoomSession room = manager.requireSession(roomId);
        assertThat(room.isMember("u1")).isFalse();
        assertThat(room.isActive()).isTrue();
        assertThat(received("owner", MessageTypes.MEMBER, MessageTypes.MEMBER_LEAVE)).hasSize(1);
        try {
            verify(ws).close(CloseStatus.NORMAL);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }

        // salir dos veces no es un error
        membershipService.leave(roomId, "u1").join();
    }

    @Test
    void disbandEvictsEveryoneAndOnlyOwnerMayDoIt() {
        String roomId = createRoom();
        connect(roomId, "owner");
        connect(roomId, "u1");

        assertThat(errorOf(membershipService.disband(roomId, "u1"))).isEqualTo(ErrorCode.PERMISSION_DENIED);
        clearAll();

        membershipService.disband(roomId, "owner").join();

        assertThat(received("u1", MessageTypes.ROOM, MessageTypes.ROOM_DISBAND)).hasSize(1);
        assertThat(manager.roomExists(roomId)).isFalse();
        assertThat(errorOf(membershipService.join(roomId, "u2", "Bea", null))).isEqualTo(ErrorCode.ROOM_NOT_FOUND);
    }

    @Test
    void ownerDisconnectFreezesByDefault() {
        String roomId = createRoom();
        WebSocketSession ownerWs = connect(roomId, "owner");
        connect(roomId, "f1");
        listen(roomId, "owner");
        listen(roomId, "f1");

        membershipService.disconnect(roomId, "owner", ownerWs).join();

        RoomSession room = manager.requireSession(roomId);
        assertThat(room.getOwnerId()).isEqualTo("owner");
        assertThat(room.getMember("owner").isOnline()).isFalse();
        assertThat(room.getMaster()).isNotNull();
        assertThat(room.getActiveMaster()).isNull();
        assertThat(room.getMember("f1").getMode()).isEqualTo(MemberMode.LISTEN);
    }

    @Test
    void ownerDisconnectTransfersToEarliestOnlineMemberWhenConfigured() {
        properties.setOwnerDisconnectPolicy(RoomProperties.OwnerDisconnectPolicy.TRANSFER);
        String roomId = createRoom();
        WebSocketSession ownerWs = connect(roomId, "owner");
        WebSocketSession firstWs = connect(roomId, "u1");
        connect(roomId, "u2");
        membershipService.disconnect(roomId, "u1", firstWs).join();

        membershipService.disconnect(roomId, "owner", ownerWs).join();

        RoomSession room = manager.requireSession(roomId);
        assertThat(room.getOwnerId()).isEqualTo("u2");
        assertThat(room.getMember("u2").getRole()).isEqualTo(MemberRole.OWNER);
        assertThat(room.getMember("owner").getRole()).isEqualTo(MemberRole.MEMBER);
    }

    @Test
    void staleDisconnectIsIgnoredAfterReconnect() {
        String roomId = createRoom();
        WebSocketSession oldWs = connect(roomId, "u1");
        connect(roomId, "u1");

        membershipService.disconnect(roomId, "u1", oldWs).join();

        assertThat(manager.requireSession(roomId).getMember("u1").isOnline()).isTrue();
    }

    @Test
    void myRoomsListsMembershipsWithOwnerFlag() {
        String roomId = createRoom();
        membershipService.join(roomId, "u1", "Ana", null).join();

        List<UserRoomInfo> ownerRooms = membershipService.getMyRooms("owner");
        List<UserRoomInfo> memberRooms = membershipService.getMyRooms("u1");

        assertThat(ownerRooms).singleElement().satisfies(info -> {
            assertThat(info.getId()).isEqualTo(roomId);
            assertThat(info.isOwner()).isTrue();
            assertThat(info.getMemberCount()).isEqualTo(2);
        });
        assertThat(memberRooms).singleElement().satisfies(info -> assertThat(info.isOwner()).isFalse());
        assertThat(membershipService.getMyRooms("stranger")).isEmpty();
    }
}
