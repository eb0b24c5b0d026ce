package com.blocksub.ingestion.adapter;

import com.blocksub.domain.BlockHeader;

/**
 * Pull-style header source, called on the poll timer.
 */
public interface HeaderFetcher {

    /**
     * Latest header known to the node. Safe to call repeatedly; every failure is reported fresh.
     *
     * @throws RpcException if the RPC call fails or the response cannot be parsed
     */
    BlockHeader fetchLatestHeader();
}
