package com.blocksub.head.config;

import com.blocksub.head.BlockSub;
import com.blocksub.head.BlockSubMetrics;
import com.blocksub.ingestion.adapter.HeaderFetcher;
import com.blocksub.ingestion.adapter.NewHeadsSubscriber;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires BlockSub from whichever header sources are configured. BlockSub is stopped when the context closes.
 */
@Configuration
@EnableConfigurationProperties(BlockSubProperties.class)
public class BlockSubConfig {

    /** In-memory registry unless the application provides one (e.g. a Prometheus registry). */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public BlockSubMetrics blockSubMetrics(MeterRegistry meterRegistry) {
        return new BlockSubMetrics(meterRegistry);
    }

    @Bean(destroyMethod = "stop")
    public BlockSub blockSub(ObjectProvider<HeaderFetcher> headerFetcher,
                             ObjectProvider<NewHeadsSubscriber> newHeadsSubscriber,
                             BlockSubProperties properties,
                             BlockSubMetrics metrics) {
        return new BlockSub(headerFetcher.getIfAvailable(), newHeadsSubscriber.getIfAvailable(), properties, metrics);
    }
}
