package com.blocksub.ingestion.adapter;

/**
 * Push-style header source.
 */
public interface NewHeadsSubscriber {

    /**
     * Opens a new connection and subscribes to new heads. Blocks until the subscription is confirmed.
     *
     * @throws RpcException if the connection or the subscription request fails
     */
    HeadStream subscribeNewHeads();
}
