package quickpoll.websockets.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import quickpoll.websockets.websocket.PollWebSocketHandler;

import java.util.Arrays;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer, WebMvcConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

    private final PollWebSocketHandler pollWebSocketHandler;
    private final String allowedOrigins;

    public WebSocketConfig(
            PollWebSocketHandler pollWebSocketHandler,
            @Value("${app.cors.allowed-origins}") String allowedOrigins
    ) {
        this.pollWebSocketHandler = pollWebSocketHandler;
        this.allowedOrigins = allowedOrigins;
    }

    @PostConstruct
    public void logConfig() {
        log.info("CORS allowed origins: {}", allowedOrigins);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = origins();
        log.info("Registering WebSocket endpoint /ws with origins: {}", Arrays.toString(origins));

        registry.addHandler(pollWebSocketHandler, "/ws")
                .setAllowedOriginPatterns(origins);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(origins())
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(true);
    }

    private String[] origins() {
        // Trim whitespace from each origin
        return Arrays.stream(allowedOrigins.split(","))
                .map(String::trim)
                .toArray(String[]::new);
    }
}
