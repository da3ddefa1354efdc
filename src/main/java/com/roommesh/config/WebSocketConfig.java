package com.roommesh.config;

import com.roommesh.dto.SignalingEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {
    private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

    private final RelayProperties properties;

    public WebSocketConfig(RelayProperties properties) {
        this.properties = properties;
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/queue", "/topic");
        config.setApplicationDestinationPrefixes(SignalingEvents.APP_PREFIX);
        config.setUserDestinationPrefix("/user");
        config.setPreservePublishOrder(true);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        log.info("STOMP endpoint {} (allowed origins {})",
                properties.getEndpoint(), properties.getAllowedOriginPatterns());
        registry.addEndpoint(properties.getEndpoint())
                .setHandshakeHandler(new ParticipantHandshakeHandler())
                .setAllowedOriginPatterns(properties.getAllowedOriginPatterns().toArray(new String[0]));
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        // One dispatcher thread keeps every connection's frames in receipt order.
        registration.taskExecutor().corePoolSize(1).maxPoolSize(1);
    }
}
