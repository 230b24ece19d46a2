package com.rebenew.listenParty.syncclient.transport;

import com.rebenew.listenParty.protocol.SyncMsg;

/**
 * Canal bidireccional con el servidor de la sala.
 */
public interface RoomTransport {

    /**
     * Abre la conexión de forma asíncrona. El resultado llega por onOpen u onClose.
     */
    void connect(Listener listener);

    /**
     * @return false si no hay conexión o el envío falló
     */
    boolean send(SyncMsg message);

    boolean isConnected();

    void close();

    interface Listener {
        void onOpen();

        void onMessage(SyncMsg message);

        void onClose(String reason);
    }
}
