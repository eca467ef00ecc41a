package com.ivamare.eventbus.health;

import com.ivamare.eventbus.broker.BrokerChannel;
import com.ivamare.eventbus.broker.ChannelPool;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for broker connectivity.
 *
 * <p>Opens and closes a channel on each check.
 */
public class BrokerHealthIndicator implements HealthIndicator {

    private final ChannelPool channelPool;

    public BrokerHealthIndicator(ChannelPool channelPool) {
        this.channelPool = channelPool;
    }

    @Override
    public Health health() {
        if (!channelPool.isOpen()) {
            return Health.down()
                .withDetail("error", "Channel pool is closed")
                .build();
        }
        try (BrokerChannel channel = channelPool.openChannel()) {
            if (!channel.isOpen()) {
                return Health.down()
                    .withDetail("error", "Channel closed by broker")
                    .build();
            }
            return Health.up()
                .withDetail("broker", "reachable")
                .build();
        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }
}
