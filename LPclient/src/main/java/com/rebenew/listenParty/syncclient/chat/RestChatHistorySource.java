package com.rebenew.listenParty.syncclient.chat;

import com.rebenew.listenParty.protocol.model.ChatMessageView;
import com.rebenew.listenParty.syncclient.SyncOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.List;

/**
 * Historial de chat vía GET /api/rooms/{roomId}/messages.
 */
public class RestChatHistorySource implements ChatHistorySource {
    private static final Logger logger = LoggerFactory.getLogger(RestChatHistorySource.class);

    private static final ParameterizedTypeReference<List<ChatMessageView>> MESSAGE_LIST =
            new ParameterizedTypeReference<>() {
            };

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String userId;
    private final String username;

    /**
     * Cliente HTTP propio con los timeouts de conexión y lectura de {@link SyncOptions}.
     */
    public RestChatHistorySource(String baseUrl, String userId, String username, SyncOptions options) {
        this(new RestTemplate(requestFactory(options)), baseUrl, userId, username);
    }

    public RestChatHistorySource(RestTemplate restTemplate, String baseUrl, String userId, String username) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.userId = userId;
        this.username = username;
    }

    static SimpleClientHttpRequestFactory requestFactory(SyncOptions options) {
        SimpleClientHttpRequestFactory rf = new SimpleClientHttpRequestFactory();
        rf.setConnectTimeout(options.getHistoryConnectTimeoutMs());
        rf.setReadTimeout(options.getHistoryReadTimeoutMs());
        return rf;
    }

    @Override
    public List<ChatMessageView> fetchHistory(String roomId, int limit) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-User-Id", userId);
        headers.set("X-Username", username);

        String url = baseUrl + "/api/rooms/{roomId}/messages?limit={limit}";
        ResponseEntity<List<ChatMessageView>> resp = restTemplate.exchange(url, HttpMethod.GET,
                new HttpEntity<>(headers), MESSAGE_LIST, roomId, limit);
        List<ChatMessageView> body = resp.getBody();
        logger.debug("📜 History for room {}: {} messages", roomId, body != null ? body.size() : 0);
        return body != null ? body : Collections.emptyList();
    }
}
