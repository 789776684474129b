package com.nexus.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final Environment environment;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        String address = environment.getProperty("server.address");
        String host = (address == null || address.isBlank() || "0.0.0.0".equals(address)) ? "localhost" : address;
        String baseUrl = String.format("http://%s:%d", host, port);
        log.info("Nexus journal started on port {} (API docs: {}/swagger-ui.html)", port, baseUrl);
    }
}
