package com.blocksub.head;

import com.blocksub.config.AsyncConfig;
import com.blocksub.domain.BlockHeader;
import com.blocksub.head.config.BlockSubProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Starts BlockSub on application start and, if enabled, logs every new head from one subscription.
 */
@Component
@ConditionalOnProperty(prefix = "blocksub", name = "autostart", havingValue = "true", matchIfMissing = true)
@Slf4j
public class HeaderLoggingRunner implements ApplicationRunner {

    private final BlockSub blockSub;
    private final BlockSubProperties properties;
    private final Executor headerLogExecutor;

    public HeaderLoggingRunner(BlockSub blockSub,
                               BlockSubProperties properties,
                               @Qualifier(AsyncConfig.HEADER_LOG_EXECUTOR) Executor headerLogExecutor) {
        this.blockSub = blockSub;
        this.properties = properties;
        this.headerLogExecutor = headerLogExecutor;
    }

    @Override
    public void run(ApplicationArguments args) {
        blockSub.start();
        if (properties.isLogHeaders()) {
            Subscription subscription = blockSub.subscribe();
            headerLogExecutor.execute(() -> logHeaders(subscription));
        }
    }

    void logHeaders(Subscription subscription) {
        try {
            BlockHeader header;
            while ((header = subscription.take()) != null) {
                log.info("New header number={} hash={}", header.numberAsString(), header.hash());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Header subscription finished");
    }
}
