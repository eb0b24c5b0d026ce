package com.blocksub.ingestion.adapter.evm;

import com.blocksub.domain.BlockHeader;
import com.blocksub.ingestion.adapter.HeadStream;
import com.blocksub.ingestion.adapter.NewHeadsSubscriber;
import com.blocksub.ingestion.adapter.RpcException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * eth_subscribe("newHeads") over a websocket. Every call opens a fresh connection; the returned stream owns it.
 */
@Slf4j
public class WebSocketNewHeadsSubscriber implements NewHeadsSubscriber {

    static final int SUBSCRIBE_ID = 1;
    static final String SUBSCRIBE_REQUEST =
            "{\"jsonrpc\":\"2.0\",\"id\":" + SUBSCRIBE_ID + ",\"method\":\"eth_subscribe\",\"params\":[\"newHeads\"]}";

    private final WebSocketClient client;
    private final EvmHeaderParser parser;
    private final URI endpoint;
    private final Duration connectTimeout;

    public WebSocketNewHeadsSubscriber(WebSocketClient client, EvmHeaderParser parser, String endpointUrl, Duration connectTimeout) {
        if (endpointUrl == null || endpointUrl.isBlank()) {
            throw new IllegalArgumentException("Websocket endpoint required");
        }
        this.client = client;
        this.parser = parser;
        this.endpoint = URI.create(endpointUrl);
        this.connectTimeout = connectTimeout;
    }

    @Override
    public HeadStream subscribeNewHeads() {
        log.info("Connecting newHeads subscription to {}", endpoint);
        WebSocketHeadStream stream = new WebSocketHeadStream();
        stream.open();
        String subscriptionId;
        try {
            subscriptionId = stream.subscriptionId.asMono().block(connectTimeout);
        } catch (RuntimeException e) {
            stream.close();
            if (e instanceof RpcException rpc) {
                throw rpc;
            }
            throw new RpcException("newHeads subscription failed on " + endpoint + ": " + e.getMessage(), e);
        }
        if (subscriptionId == null) {
            stream.close();
            throw new RpcException("newHeads subscription on " + endpoint + " ended without confirmation");
        }
        log.info("Subscribed to newHeads on {} (subscription {})", endpoint, subscriptionId);
        return stream;
    }

    URI getEndpoint() {
        return endpoint;
    }

    /**
     * Routes one inbound websocket frame: the eth_subscribe reply confirms the subscription,
     * eth_subscription notifications carry headers. Anything else is ignored.
     */
    void route(String text, Sinks.One<String> subscriptionId, Sinks.Many<BlockHeader> headers) {
        JsonNode node = parser.readTree(text);
        if (node.path("id").asInt(-1) == SUBSCRIBE_ID) {
            JsonNode error = node.path("error");
            if (!error.isMissingNode() && !error.isNull()) {
                throw new RpcException("eth_subscribe error: " + error);
            }
            subscriptionId.tryEmitValue(node.path("result").asText());
            return;
        }
        if ("eth_subscription".equals(node.path("method").asText())) {
            headers.tryEmitNext(parser.parseHeader(node.path("params").path("result")));
        }
    }

    private final class WebSocketHeadStream implements HeadStream {

        private final Sinks.Many<BlockHeader> headers = Sinks.many().unicast().onBackpressureBuffer();
        private final Sinks.One<String> subscriptionId = Sinks.one();
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private volatile Disposable connection;

        void open() {
            connection = client.execute(endpoint, session -> session
                            .send(Mono.just(session.textMessage(SUBSCRIBE_REQUEST)))
                            .and(session.receive()
                                    .map(WebSocketMessage::getPayloadAsText)
                                    .doOnNext(text -> route(text, subscriptionId, headers))
                                    .then()))
                    .subscribe(ignored -> { }, this::onConnectionError, this::onConnectionClosed);
        }

        private void onConnectionError(Throwable e) {
            RpcException failure = e instanceof RpcException rpc
                    ? rpc
                    : new RpcException("Websocket failure on " + endpoint + ": " + e.getMessage(), e);
            fail(failure);
        }

        private void onConnectionClosed() {
            if (!closed.get()) {
                fail(new RpcException("Websocket closed by " + endpoint));
            }
        }

        private void fail(RpcException failure) {
            subscriptionId.tryEmitError(failure);
            headers.tryEmitError(failure);
        }

        @Override
        public Flux<BlockHeader> headers() {
            return headers.asFlux();
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            Disposable c = connection;
            if (c != null) {
                c.dispose();
            }
            subscriptionId.tryEmitError(new RpcException("Subscription closed"));
            headers.tryEmitComplete();
            log.debug("Closed newHeads connection to {}", endpoint);
        }
    }
}
