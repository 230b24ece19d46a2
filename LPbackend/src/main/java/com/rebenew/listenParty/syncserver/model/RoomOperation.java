package com.rebenew.listenParty.syncserver.model;

import com.rebenew.listenParty.protocol.MessageTypes;

/**
 * Operaciones sujetas al PermissionGate.
 */
public enum RoomOperation {
    DISBAND,
    GRANT_CONTROL,
    TRANSFER_OWNER,
    ADD_SONG,
    REMOVE_SONG,
    REORDER_SONG,
    PLAY,
    PAUSE,
    SEEK,
    NEXT,
    PREV,
    SET_MODE,
    REPORT_PLAYBACK;

    /**
     * Traduce un comando de control del canal a su operación; null si no existe.
     */
    public static RoomOperation fromCommand(String command) {
        if (command == null)
            return null;
        switch (command) {
            case MessageTypes.COMMAND_PLAY:
            case MessageTypes.COMMAND_PLAY_SONG:
                return PLAY;
            case MessageTypes.COMMAND_PAUSE:
                return PAUSE;
            case MessageTypes.COMMAND_SEEK:
                return SEEK;
            case MessageTypes.COMMAND_NEXT:
                return NEXT;
            case MessageTypes.COMMAND_PREV:
                return PREV;
            default:
                return null;
        }
    }
}
