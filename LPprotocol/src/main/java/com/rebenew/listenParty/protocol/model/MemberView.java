package com.rebenew.listenParty.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Proyección pública de un miembro, tal como se difunde en member_list.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MemberView {
    private String userId;
    private String username;
    private String avatar;
    private MemberRole role;
    private MemberMode mode;
    private boolean canControl;
    private boolean online;
    private long joinedAt;

    public boolean isOwner() {
        return role == MemberRole.OWNER;
    }
}
