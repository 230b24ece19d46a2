package com.rebenew.listenParty.syncclient;

import lombok.Builder;
import lombok.Getter;

/**
 * Parámetros del motor de cliente.
 */
@Getter
@Builder(toBuilder = true)
public class SyncOptions {
    // Reporte periódico del master mientras reproduce
    @Builder.Default
    private final long heartbeatIntervalMs = 5000;
    // Diferencia máxima tolerada antes de un seek correctivo
    @Builder.Default
    private final double driftThresholdSeconds = 2.0;
    @Builder.Default
    private final long reconnectBaseDelayMs = 1000;
    @Builder.Default
    private final long reconnectMaxDelayMs = 30000;
    @Builder.Default
    private final int reconnectMaxAttempts = 10;
    // Proyectar la posición objetivo con now - reportedAt
    @Builder.Default
    private final boolean extrapolatePosition = false;
    @Builder.Default
    private final int historyLimit = 50;
    @Builder.Default
    private final int historyConnectTimeoutMs = 5000;
    @Builder.Default
    private final int historyReadTimeoutMs = 10000;
    // Latido del canal; debe quedar por debajo del client-timeout-ms del servidor
    @Builder.Default
    private final long keepAliveIntervalMs = 30000;

    public static SyncOptions defaults() {
        return SyncOptions.builder().build();
    }
}
