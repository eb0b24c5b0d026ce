package com.blocksub.ingestion.adapter.evm;

import com.blocksub.ingestion.adapter.RpcException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * EVM JSON-RPC client using WebClient. Used by EvmHeaderFetcher.
 */
public class WebClientEvmRpcClient implements EvmRpcClient {

    private final WebClient webClient;
    private final AtomicLong nextId = new AtomicLong(1);

    public WebClientEvmRpcClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", nextId.getAndIncrement(),
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class, e -> new RpcException(e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class, e -> new RpcException(e.getMessage(), e));
    }
}
