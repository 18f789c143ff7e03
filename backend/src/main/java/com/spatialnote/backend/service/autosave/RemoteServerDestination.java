package com.spatialnote.backend.service.autosave;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Notebook server contents API:
 * {@code PUT {server}/api/contents/{path}} with a notebook model body.
 */
@Component
public class RemoteServerDestination implements SaveDestination {
    private final AutoSaveSettings settings;
    private final ObjectMapper om;

    public RemoteServerDestination(AutoSaveSettings settings, ObjectMapper om) {
        this.settings = settings;
        this.om = om;
    }

    @Override
    public String name() {
        return "remote-server";
    }

    @Override
    public boolean isEnabled() {
        return settings.isSaveToServer();
    }

    @Override
    public String write(byte[] document) throws IOException {
        String base = stripTrailingSlash(settings.getServerUrl());
        String path = stripLeadingSlash(settings.getServerPath());

        ObjectNode body = om.createObjectNode();
        body.put("type", "notebook");
        body.put("format", "json");
        body.set("content", om.readTree(document));

        RestClient.RequestBodySpec request = client(settings.getServerTimeout())
                .put()
                .uri(contentsUri(base, path))
                .contentType(MediaType.APPLICATION_JSON);
        String token = settings.getServerToken();
        if (token != null && !token.isBlank()) {
            request.header(HttpHeaders.AUTHORIZATION, "token " + token);
        }
        try {
            request.body(om.writeValueAsBytes(body)).retrieve().toBodilessEntity();
        } catch (RestClientException e) {
            throw new IOException("notebook server write failed: " + e.getMessage(), e);
        }
        return base + "/api/contents/" + path;
    }

    // nested paths keep their slashes
    private static URI contentsUri(String base, String path) {
        return UriComponentsBuilder.fromHttpUrl(base)
                .path("/api/contents/")
                .path(path)
                .encode()
                .build()
                .toUri();
    }

    private static RestClient client(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        if (timeout != null) {
            factory.setConnectTimeout(timeout);
            factory.setReadTimeout(timeout);
        }
        return RestClient.builder().requestFactory(factory).build();
    }

    private static String stripTrailingSlash(String s) {
        String out = s == null ? "" : s.trim();
        while (out.endsWith("/")) out = out.substring(0, out.length() - 1);
        return out;
    }

    private static String stripLeadingSlash(String s) {
        String out = s == null ? "" : s.trim();
        while (out.startsWith("/")) out = out.substring(1);
        return out;
    }
}
