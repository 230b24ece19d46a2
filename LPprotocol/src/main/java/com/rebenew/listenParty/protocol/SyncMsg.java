package com.rebenew.listenParty.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

import java.util.HashMap;
import java.util.Map;

/**
 * Mensaje WebSocket unificado de la sala.
 * Todos los payloads viajan en el campo 'data'; el tipo y subtipo deciden su forma.
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncMsg {
    // Metadatos básicos
    private String type; // ver MessageTypes
    private String subType;
    private String roomId;
    private String senderId;
    private String correlationId;
    private Long timestamp;

    private Object data;

    // ==================== CONSTRUCTORES ESTÁTICOS ====================

    public static SyncMsg of(String type, String subType, String roomId, Object data) {
        return new SyncMsg(type, subType, roomId, null, data);
    }

    public static SyncMsg request(String type, String subType, String roomId, String senderId, Object data) {
        return new SyncMsg(type, subType, roomId, senderId, data);
    }

    public static SyncMsg auth(String roomId, String senderId, String username) {
        Map<String, Object> authData = new HashMap<>();
        authData.put("username", username);
        return new SyncMsg(MessageTypes.AUTH, null, roomId, senderId, authData);
    }

    public static SyncMsg ack(boolean success, String reason, String correlationId) {
        Map<String, Object> ackData = Map.of("success", success, "reason", reason);
        SyncMsg msg = new SyncMsg(MessageTypes.ACK, null, null, null, ackData);
        msg.setCorrelationId(correlationId);
        return msg;
    }

    public static SyncMsg error(String errorCode, String message, String correlationId) {
        Map<String, Object> errorData = new HashMap<>();
        errorData.put("code", errorCode);
        errorData.put("message", message);
        SyncMsg msg = new SyncMsg(MessageTypes.ERROR, null, null, null, errorData);
        msg.setCorrelationId(correlationId);
        return msg;
    }

    public static SyncMsg heartbeat(String roomId, String senderId) {
        return new SyncMsg(MessageTypes.HEARTBEAT, null, roomId, senderId, null);
    }

    // Constructor principal privado
    private SyncMsg(String type, String subType, String roomId, String senderId, Object data) {
        this.type = type;
        this.subType = subType;
        this.roomId = roomId;
        this.senderId = senderId;
        this.data = data;
        this.timestamp = System.currentTimeMillis();
    }

    // Constructor público vacío para Jackson
    public SyncMsg() {
        this.timestamp = System.currentTimeMillis();
    }

    public SyncMsg withCorrelationId(String correlationId) {
        this.correlationId = correlationId;
        return this;
    }

    // ==================== MÉTODOS DE CONVENIENCIA ====================

    @JsonIgnore
    public boolean is(String expectedType, String expectedSubType) {
        return expectedType.equals(type) && (expectedSubType == null || expectedSubType.equals(subType));
    }

    @JsonIgnore
    public boolean isAck() {
        return MessageTypes.ACK.equals(type);
    }

    @JsonIgnore
    public boolean isError() {
        return MessageTypes.ERROR.equals(type);
    }

    /**
     * Verifica si es un ACK exitoso
     */
    @JsonIgnore
    public boolean isSuccess() {
        if (!isAck())
            return false;
        Map<String, Object> ackData = getDataAsMap();
        return ackData != null && Boolean.TRUE.equals(ackData.get("success"));
    }

    /**
     * Extracción segura de datos
     */
    @SuppressWarnings("unchecked")
    @JsonIgnore
    public Map<String, Object> getDataAsMap() {
        return data instanceof Map ? (Map<String, Object>) data : null;
    }

    public String getStringData(String key) {
        Map<String, Object> dataMap = getDataAsMap();
        Object value = dataMap != null ? dataMap.get(key) : null;
        return value != null ? value.toString() : null;
    }

    public Integer getIntData(String key) {
        Map<String, Object> dataMap = getDataAsMap();
        Object value = dataMap != null ? dataMap.get(key) : null;
        if (value instanceof Number)
            return ((Number) value).intValue();
        if (value instanceof String) {
            try {
                return Integer.parseInt((String) value);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public Double getDoubleData(String key) {
        Map<String, Object> dataMap = getDataAsMap();
        Object value = dataMap != null ? dataMap.get(key) : null;
        if (value instanceof Number)
            return ((Number) value).doubleValue();
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public Boolean getBoolData(String key) {
        Map<String, Object> dataMap = getDataAsMap();
        Object value = dataMap != null ? dataMap.get(key) : null;
        if (value instanceof Boolean)
            return (Boolean) value;
        if (value instanceof String)
            return Boolean.parseBoolean((String) value);
        return null;
    }

    public Boolean getBoolData(String key, boolean defaultValue) {
        Boolean value = getBoolData(key);
        return value != null ? value : defaultValue;
    }

    @Override
    public String toString() {
        return String.format("SyncMsg{type='%s', subType='%s', roomId='%s', senderId='%s', timestamp=%d}",
                type, subType, roomId, senderId, timestamp);
    }
}
