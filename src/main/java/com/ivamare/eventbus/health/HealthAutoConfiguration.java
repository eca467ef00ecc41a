package com.ivamare.eventbus.health;

import com.ivamare.eventbus.EventBusAutoConfiguration;
import com.ivamare.eventbus.broker.ChannelPool;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Event Bus health indicators.
 */
@AutoConfiguration(after = EventBusAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "eventbus", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnBean(ChannelPool.class)
    @ConditionalOnMissingBean(BrokerHealthIndicator.class)
    public BrokerHealthIndicator brokerHealthIndicator(ChannelPool channelPool) {
        return new BrokerHealthIndicator(channelPool);
    }
}
