package com.rebenew.listenParty.syncclient.chat;

import com.rebenew.listenParty.protocol.model.ChatMessageView;

import java.util.List;

@FunctionalInterface
public interface ChatHistorySource {

    /**
     * Últimos mensajes de la sala, en orden ascendente de id.
     */
    List<ChatMessageView> fetchHistory(String roomId, int limit);
}
