package com.rebenew.listenParty.protocol;

/**
 * Tipos y subtipos de {@link SyncMsg} usados en el canal de sala.
 */
public final class MessageTypes {

    private MessageTypes() {
    }

    // ==================== TIPOS ====================
    public static final String AUTH = "auth";
    public static final String ACK = "ack";
    public static final String ERROR = "error";
    public static final String HEARTBEAT = "heartbeat";
    public static final String SYNC = "sync";
    public static final String FULL_STATE = "full_state";
    public static final String MEMBER_LIST = "member_list";
    public static final String MEMBER = "member";
    public static final String MODE = "mode";
    public static final String PLAYLIST = "playlist";
    public static final String PLAYBACK = "playback";
    public static final String CHAT = "chat";
    public static final String ROOM = "room";

    // ==================== SUBTIPOS: playlist ====================
    public static final String PLAYLIST_ADD = "add";
    public static final String PLAYLIST_REMOVE = "remove";
    public static final String PLAYLIST_REORDER = "reorder";
    public static final String PLAYLIST_UPDATE = "update";

    // ==================== SUBTIPOS: playback ====================
    /** Reporte del master hacia el servidor. */
    public static final String PLAYBACK_REPORT = "report";
    /** Snapshot reenviado por el servidor a los seguidores. */
    public static final String PLAYBACK_MASTER_SYNC = "master_sync";
    /** Un seguidor pide el estado actual. */
    public static final String PLAYBACK_REQUEST = "request";
    /** El servidor pide al master un reporte inmediato. */
    public static final String PLAYBACK_MASTER_REQUEST = "master_request";
    /** Comando de control reenviado al master. */
    public static final String PLAYBACK_CONTROL = "control";

    // ==================== SUBTIPOS: mode ====================
    public static final String MODE_SET = "set";
    public static final String MODE_MASTER_MODE = "master_mode";

    // ==================== SUBTIPOS: member ====================
    public static final String MEMBER_JOIN = "join";
    public static final String MEMBER_LEAVE = "leave";
    public static final String MEMBER_GRANT_CONTROL = "grant_control";
    public static final String MEMBER_TRANSFER_OWNER = "transfer_owner";
    public static final String MEMBER_ROLE_UPDATE = "role_update";
    public static final String MEMBER_OFFLINE = "offline";

    // ==================== SUBTIPOS: room ====================
    public static final String ROOM_LEAVE = "leave";
    public static final String ROOM_DISBAND = "disband";

    // ==================== COMANDOS DE CONTROL ====================
    public static final String COMMAND_PLAY = "play";
    public static final String COMMAND_PAUSE = "pause";
    public static final String COMMAND_SEEK = "seek";
    public static final String COMMAND_NEXT = "next";
    public static final String COMMAND_PREV = "prev";
    public static final String COMMAND_PLAY_SONG = "play_song";
}
