package com.blocksub.ingestion.adapter.evm;

import com.blocksub.domain.BlockHeader;
import com.blocksub.ingestion.adapter.HeaderFetcher;
import com.blocksub.ingestion.adapter.RpcException;

import java.time.Duration;
import java.util.List;

/**
 * Fetches the latest EVM header via eth_getBlockByNumber("latest", false).
 */
public class EvmHeaderFetcher implements HeaderFetcher {

    static final String METHOD = "eth_getBlockByNumber";

    private final EvmRpcClient rpcClient;
    private final EvmHeaderParser parser;
    private final String endpointUrl;
    private final Duration requestTimeout;

    public EvmHeaderFetcher(EvmRpcClient rpcClient, EvmHeaderParser parser, String endpointUrl, Duration requestTimeout) {
        if (endpointUrl == null || endpointUrl.isBlank()) {
            throw new IllegalArgumentException("HTTP endpoint required");
        }
        this.rpcClient = rpcClient;
        this.parser = parser;
        this.endpointUrl = endpointUrl;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public BlockHeader fetchLatestHeader() {
        String json;
        try {
            json = rpcClient.call(endpointUrl, METHOD, List.of("latest", false)).block(requestTimeout);
        } catch (RpcException e) {
            throw e;
        } catch (RuntimeException e) {
            // timeout (IllegalStateException) or a checked failure wrapped by block()
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new RpcException(METHOD + " failed on " + endpointUrl + ": " + cause.getMessage(), e);
        }
        return parser.parseResponse(json, METHOD);
    }

    public String getEndpointUrl() {
        return endpointUrl;
    }
}
