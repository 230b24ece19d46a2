package com.rebenew.listenParty.syncclient.chat;

import com.rebenew.listenParty.protocol.model.ChatMessageView;
import com.rebenew.listenParty.syncclient.SyncOptions;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestChatHistorySourceTest {

    @Test
    void fetchesHistoryWithIdentityHeaders() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo("http://localhost:8080/api/rooms/100001/messages?limit=50"))
                .andExpect(header("X-User-Id", "bob"))
                .andExpect(header("X-Username", "Bob"))
                .andRespond(withSuccess("[{\"id\":4,\"roomId\":\"100001\",\"userId\":\"carol\","
                        + "\"content\":\"hola\",\"createdAt\":1,\"messageType\":\"chat\"}]",
                        MediaType.APPLICATION_JSON));
        RestChatHistorySource source = new RestChatHistorySource(restTemplate, "http://localhost:8080/", "bob",
                "Bob");

        List<ChatMessageView> history = source.fetchHistory("100001", 50);

        assertThat(history).extracting(ChatMessageView::getContent).containsExactly("hola");
        server.verify();
    }

    @Test
    void unresponsiveServerFailsAfterReadTimeout() throws Exception {
        SyncOptions options = SyncOptions.builder().historyReadTimeoutMs(300).build();
        try (ServerSocket silent = new ServerSocket(0)) {
            Thread acceptor = new Thread(() -> {
                // acepta y nunca responde
                try (Socket ignored = silent.accept()) {
                    Thread.sleep(5000);
                } catch (Exception e) {
                    Thread.currentThread().interrupt();
                }
            });
            acceptor.setDaemon(true);
            acceptor.start();
            RestChatHistorySource source = new RestChatHistorySource("http://localhost:" + silent.getLocalPort(),
                    "bob", "Bob", options);

            assertTimeoutPreemptively(Duration.ofSeconds(3), () ->
                    assertThatThrownBy(() -> source.fetchHistory("100001", 50))
                            .isInstanceOf(ResourceAccessException.class));
        }
    }
}
