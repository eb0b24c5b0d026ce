package com.blocksub.ingestion.config;

import com.blocksub.ingestion.adapter.HeaderFetcher;
import com.blocksub.ingestion.adapter.NewHeadsSubscriber;
import com.blocksub.ingestion.adapter.evm.EvmHeaderFetcher;
import com.blocksub.ingestion.adapter.evm.EvmHeaderParser;
import com.blocksub.ingestion.adapter.evm.EvmRpcClient;
import com.blocksub.ingestion.adapter.evm.WebClientEvmRpcClient;
import com.blocksub.ingestion.adapter.evm.WebSocketNewHeadsSubscriber;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import java.time.Duration;

/**
 * Header sources from blocksub.rpc: HTTP fetcher when http-url is set, newHeads subscriber when ws-url is set.
 */
@Configuration
@EnableConfigurationProperties(IngestionRpcProperties.class)
public class IngestionAdapterConfig {

    @Bean
    public EvmHeaderParser evmHeaderParser(ObjectMapper objectMapper) {
        return new EvmHeaderParser(objectMapper);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean
    @ConditionalOnProperty(prefix = "blocksub.rpc", name = "http-url")
    public HeaderFetcher evmHeaderFetcher(EvmRpcClient evmRpcClient, EvmHeaderParser parser, IngestionRpcProperties properties) {
        return new EvmHeaderFetcher(evmRpcClient, parser, properties.getHttpUrl(),
                Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "blocksub.rpc", name = "ws-url")
    public NewHeadsSubscriber webSocketNewHeadsSubscriber(EvmHeaderParser parser, IngestionRpcProperties properties) {
        return new WebSocketNewHeadsSubscriber(new ReactorNettyWebSocketClient(), parser, properties.getWsUrl(),
                Duration.ofMillis(properties.getConnectTimeoutMs()));
    }
}
