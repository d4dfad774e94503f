package com.example.pictochat.config;

import com.example.pictochat.handler.RoomWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import java.util.*;
import java.util.stream.Collectors;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private final RoomWebSocketHandler handler;
  private final List<String> originPatterns;
  private final String wsPath;
  private final boolean allowAll;

  public WebSocketConfig(
      RoomWebSocketHandler handler,
      @Value("${app.websocket.path:/ws}") String wsPath,
      // CSV list, expanded to origin patterns
      @Value("${app.websocket.allowed-origins:http://localhost:8080}") String originsCsv,
      // allow * during troubleshooting
      @Value("${app.websocket.debug-open:false}") boolean allowAll
  ) {
    this.handler = handler;
    this.wsPath = wsPath;
    this.allowAll = allowAll;

    List<String> list = Arrays.stream(originsCsv.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .flatMap(s -> expandToPatterns(s).stream())
        .distinct()
        .collect(Collectors.toList());

    this.originPatterns = list.isEmpty() ? Collections.singletonList("*") : list;
  }

  // localhost on any port
  static List<String> expandToPatterns(String origin) {
    List<String> out = new ArrayList<>();
    if ("*".equals(origin)) { out.add("*"); return out; }
    out.add(origin);
    if (origin.startsWith("http://localhost")) {
      out.add("http://localhost:*");
      out.add("http://127.0.0.1:*");
    }
    if (origin.startsWith("https://localhost")) {
      out.add("https://localhost:*");
    }
    return out;
  }

  /** Canvas snapshots arrive as one large text frame. */
  @Bean
  public ServletServerContainerFactoryBean createWebSocketContainer(
      @Value("${app.websocket.max-text-message-size:2097152}") int maxTextMessageSize) {
    ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
    container.setMaxTextMessageBufferSize(maxTextMessageSize);
    return container;
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    String[] patterns = allowAll ? new String[] {"*"} : originPatterns.toArray(String[]::new);
    registry.addHandler(handler, wsPath)
            .setAllowedOriginPatterns(patterns);
  }
}
