package com.rebenew.listenParty.syncclient;

import com.rebenew.listenParty.protocol.model.ChatMessageView;

/**
 * Notificaciones del motor hacia la capa de presentación. Todas opcionales.
 */
public interface RoomEventListener {

    default void onRoomStateChanged(RoomSyncClient client) {
    }

    default void onChatMessage(ChatMessageView message) {
    }

    /**
     * El owner dejó el modo listen y este cliente pasó a chat sin pedirlo.
     */
    default void onModeForced() {
    }

    default void onConnectionStateChanged(RoomSyncClient.ConnectionState state) {
    }

    default void onDisbanded() {
    }

    default void onError(String code, String message, String correlationId) {
    }
}
