package com.rebenew.listenParty.syncserver.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuración de salas.
 * Se enlaza con listen-party.room.* en application.yml
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "listen-party.room")
public class RoomProperties {

    private int maxMembers = 10;
    private int historyDefaultLimit = 50;
    private int historyMaxLimit = 100;
    private int maxMessageLength = 2000;

    private long clientTimeoutMs = 600_000L; // 10 min sin actividad
    private long sweepIntervalMs = 30_000L;

    private OwnerDisconnectPolicy ownerDisconnectPolicy = OwnerDisconnectPolicy.FREEZE;

    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:*"));

    public enum OwnerDisconnectPolicy {
        /** Los seguidores se quedan con el último snapshot hasta que vuelva el owner. */
        FREEZE,
        /** La propiedad pasa al miembro conectado más antiguo. */
        TRANSFER
    }
}
