package io.minichain.core.p2p;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.minichain.core.protocol.Block;
import io.minichain.core.protocol.ChainCodec;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Plain-HTTP peer wire:
 * - broadcast: POST http://host:port/{event} with body {@code {event, payload}}
 * - retrieval: GET http://host:port/chain returning the block-record array
 */
public final class HttpPeerTransport implements PeerTransport {
    private static final ObjectMapper MAPPER = ChainCodec.mapper();

    private final HttpClient http;
    private final Duration requestTimeout;

    public HttpPeerTransport(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public void deliver(String peer, PeerEvent event) throws PeerUnreachableException {
        byte[] body;
        try {
            body = MAPPER.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + event.event(), e);
        }
        HttpRequest request = HttpRequest.newBuilder(uri(peer, "/" + event.event()))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        HttpResponse<byte[]> response = send(peer, request);
        if (response.statusCode() / 100 != 2) {
            throw new PeerUnreachableException(peer, "HTTP " + response.statusCode() + " for " + event.event());
        }
    }

    @Override
    public List<Block> fetchChain(String peer) throws PeerUnreachableException {
        HttpRequest request = HttpRequest.newBuilder(uri(peer, "/chain"))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<byte[]> response = send(peer, request);
        if (response.statusCode() != 200) {
            throw new PeerUnreachableException(peer, "HTTP " + response.statusCode() + " for chain");
        }
        try {
            return ChainCodec.fromJson(response.body());
        } catch (IllegalArgumentException e) {
            throw new PeerUnreachableException(peer, "unreadable chain: " + e.getMessage(), e);
        }
    }

    private HttpResponse<byte[]> send(String peer, HttpRequest request) throws PeerUnreachableException {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new PeerUnreachableException(peer, e.getClass().getSimpleName() + " " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PeerUnreachableException(peer, "interrupted", e);
        }
    }

    private static URI uri(String peer, String path) {
        return URI.create("http://" + peer + path);
    }
}
