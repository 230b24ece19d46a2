package com.rebenew.listenParty.protocol.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatMessageView {
    private Long id;
    private String roomId;
    private String userId;
    private String username;
    private String content;
    @JsonAlias("timestamp")
    private long createdAt;
    private ChatMessageType messageType;
    // clave de idempotencia del cliente, devuelta tal cual por el servidor
    private String clientMessageId;
}
