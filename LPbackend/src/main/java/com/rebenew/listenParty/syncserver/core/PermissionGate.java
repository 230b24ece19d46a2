package com.rebenew.listenParty.syncserver.core;

import com.rebenew.listenParty.protocol.error.ErrorCode;
import com.rebenew.listenParty.protocol.error.RoomException;
import com.rebenew.listenParty.protocol.model.MemberRole;
import com.rebenew.listenParty.syncserver.model.Member;
import com.rebenew.listenParty.syncserver.model.RoomOperation;

/**
 * Decide si un miembro puede ejecutar una operación. Sin estado ni efectos.
 */
public final class PermissionGate {

    private PermissionGate() {
    }

    public static boolean canPerform(Member member, RoomOperation operation) {
        if (member == null || operation == null)
            return false;

        switch (operation) {
            case DISBAND:
            case GRANT_CONTROL:
            case TRANSFER_OWNER:
                return member.getRole() == MemberRole.OWNER;
            case ADD_SONG:
            case REMOVE_SONG:
            case REORDER_SONG:
            case PLAY:
            case PAUSE:
            case SEEK:
            case NEXT:
            case PREV:
                return member.getRole() == MemberRole.OWNER
                        || member.getRole() == MemberRole.ADMIN
                        || (member.getRole() == MemberRole.MEMBER && member.isCanControl());
            case SET_MODE:
                // cada miembro solo cambia su propio modo; el llamador pasa al propio miembro
                return true;
            case REPORT_PLAYBACK:
                return isMaster(member);
            default:
                return false;
        }
    }

    public static boolean isMaster(Member member) {
        return member != null && member.getRole() == MemberRole.OWNER && member.isListening();
    }

    public static boolean canGrantControlTo(Member actor, Member target) {
        return canPerform(actor, RoomOperation.GRANT_CONTROL)
                && target != null
                && target.getRole() != MemberRole.OWNER;
    }

    public static boolean canTransferOwnerTo(Member actor, Member target) {
        return canPerform(actor, RoomOperation.TRANSFER_OWNER)
                && target != null
                && !target.getUserId().equals(actor.getUserId());
    }

    /**
     * Igual que canPerform pero lanza la excepción que corresponde:
     * NOT_MASTER para reportes de reproducción, PERMISSION_DENIED para el resto.
     */
    public static void check(Member member, RoomOperation operation) {
        if (canPerform(member, operation))
            return;
        String who = member != null ? member.getUserId() : "desconocido";
        if (operation == RoomOperation.REPORT_PLAYBACK) {
            throw new RoomException(ErrorCode.NOT_MASTER, who);
        }
        throw RoomException.permissionDenied(who + " no puede " + operation.name().toLowerCase());
    }
}
