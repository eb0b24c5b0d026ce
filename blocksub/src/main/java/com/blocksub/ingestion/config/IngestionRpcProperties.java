package com.blocksub.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Node endpoints and transport timeouts. A source is enabled only when its URL is set.
 */
@ConfigurationProperties(prefix = "blocksub.rpc")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRpcProperties {

    /** JSON-RPC over HTTP, usually port 8545. Enables polling. */
    private String httpUrl;

    /** JSON-RPC over websocket, usually port 8546. Enables the newHeads subscription. */
    private String wsUrl;

    /** Timeout for one eth_getBlockByNumber call. */
    private long requestTimeoutMs = 10_000L;

    /** Timeout for opening the websocket and confirming eth_subscribe. */
    private long connectTimeoutMs = 10_000L;
}
