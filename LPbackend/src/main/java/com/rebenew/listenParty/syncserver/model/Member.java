package com.rebenew.listenParty.syncserver.model;

import com.rebenew.listenParty.protocol.model.MemberMode;
import com.rebenew.listenParty.protocol.model.MemberRole;
import com.rebenew.listenParty.protocol.model.MemberView;
import lombok.Getter;
import lombok.Setter;

/**
 * Miembro de una sala. Solo se modifica desde la cola de la sala.
 */
@Getter
@Setter
public class Member {
    private final String userId;
    private final long joinedAt;
    private final long joinOrder;

    private volatile String username;
    private volatile String avatar;
    private volatile MemberRole role;
    private volatile MemberMode mode = MemberMode.CHAT;
    private volatile boolean canControl; // solo tiene sentido con role=MEMBER
    private volatile boolean online;

    public Member(String userId, String username, String avatar, MemberRole role, long joinedAt, long joinOrder) {
        this.userId = userId;
        this.username = username;
        this.avatar = avatar;
        this.role = role;
        this.joinedAt = joinedAt;
        this.joinOrder = joinOrder;
        this.canControl = role == MemberRole.OWNER;
    }

    public boolean isOwner() {
        return role == MemberRole.OWNER;
    }

    public boolean isListening() {
        return mode == MemberMode.LISTEN;
    }

    public MemberView toView() {
        return MemberView.builder()
                .userId(userId)
                .username(username)
                .avatar(avatar)
                .role(role)
                .mode(mode)
                .canControl(canControl)
                .online(online)
                .joinedAt(joinedAt)
                .build();
    }

    @Override
    public String toString() {
        return "Member{" +
                "userId='" + userId + '\'' +
                ", role=" + role +
                ", mode=" + mode +
                ", canControl=" + canControl +
                ", online=" + online +
                '}';
    }
}
