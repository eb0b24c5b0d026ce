package com.blocksub.ingestion.adapter.evm;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC client abstraction for testing.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call. Method and params are standard Ethereum JSON-RPC.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getBlockByNumber"
     * @param params      method params (e.g. ["latest", false])
     * @return response body as string (JSON); errors with RpcException on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
