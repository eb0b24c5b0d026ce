package com.blocksub.ingestion.adapter;

import com.blocksub.domain.BlockHeader;
import reactor.core.publisher.Flux;

/**
 * One live push subscription.
 */
public interface HeadStream extends AutoCloseable {

    /**
     * Headers as they arrive. Completes after {@link #close()} (clean shutdown); errors on abnormal
     * termination such as a transport failure, a server-side close or a JSON-RPC error.
     */
    Flux<BlockHeader> headers();

    /** Releases the connection. Idempotent. */
    @Override
    void close();
}
