package com.rebenew.listenParty.syncserver.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import java.time.Clock;

@Configuration
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    // Reloj del servidor: sella reportedAt, joinedAt y createdAt
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer(RoomProperties properties) {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(16384); // snapshots y playlists completas
        container.setMaxBinaryMessageBufferSize(8192);
        container.setMaxSessionIdleTimeout(properties.getClientTimeoutMs());
        return container;
    }
}
