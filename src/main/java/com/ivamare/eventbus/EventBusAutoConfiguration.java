package com.ivamare.eventbus;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ivamare.eventbus.api.EventPublisher;
import com.ivamare.eventbus.api.impl.DefaultEventPublisher;
import com.ivamare.eventbus.audit.AuditEmitter;
import com.ivamare.eventbus.audit.AuditHandlerRegistry;
import com.ivamare.eventbus.audit.impl.DefaultAuditHandlerRegistry;
import com.ivamare.eventbus.broker.ChannelPool;
import com.ivamare.eventbus.broker.impl.RabbitChannelPool;
import com.ivamare.eventbus.codec.EventCodec;
import com.ivamare.eventbus.handler.HandlerRegistry;
import com.ivamare.eventbus.handler.impl.DefaultHandlerRegistry;
import com.ivamare.eventbus.policy.RetryPolicy;
import com.ivamare.eventbus.topology.Topology;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.net.URI;

/**
 * Auto-configuration for the Event Bus.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Broker connection and channel pool</li>
 *   <li>Topology declarer</li>
 *   <li>Event codec</li>
 *   <li>Handler registries (business and audit)</li>
 *   <li>Event publisher</li>
 *   <li>Audit emitter</li>
 *   <li>Retry policy</li>
 * </ul>
 *
 * <p>A {@link ConnectionFactory} already present in the context (for example from
 * Spring Boot's Rabbit auto-configuration) is reused.
 *
 * <p>To disable auto-configuration:
 * <pre>
 * eventbus.enabled=false
 * </pre>
 */
@AutoConfiguration(after = RabbitAutoConfiguration.class)
@ConditionalOnClass(ConnectionFactory.class)
@ConditionalOnProperty(prefix = "eventbus", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(EventBusProperties.class)
public class EventBusAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper eventBusObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public EventCodec eventCodec(ObjectMapper objectMapper) {
        return new EventCodec(objectMapper);
    }

    // --- Broker ---

    @Bean
    @ConditionalOnMissingBean(ConnectionFactory.class)
    public CachingConnectionFactory eventBusConnectionFactory(EventBusProperties properties) {
        EventBusProperties.BrokerProperties broker = properties.getBroker();
        CachingConnectionFactory factory = new CachingConnectionFactory(URI.create(broker.getUri()));
        factory.setConnectionNameStrategy(cf -> broker.getConnectionName());
        factory.setChannelCacheSize(broker.getChannelCacheSize());
        if (broker.isPublisherConfirms()) {
            factory.setPublisherConfirmType(CachingConnectionFactory.ConfirmType.SIMPLE);
        }
        return factory;
    }

    @Bean
    @ConditionalOnMissingBean
    public ChannelPool channelPool(ConnectionFactory connectionFactory) {
        return new RabbitChannelPool(connectionFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public Topology topology(ChannelPool channelPool) {
        return new Topology(channelPool);
    }

    // --- Handler Registries ---

    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry() {
        return new DefaultHandlerRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditHandlerRegistry auditHandlerRegistry() {
        return new DefaultAuditHandlerRegistry();
    }

    // --- Retry Policy ---

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(EventBusProperties properties) {
        return properties.getRetry().toPolicy();
    }

    // --- Publishing ---

    @Bean
    @ConditionalOnMissingBean
    public EventPublisher eventPublisher(ChannelPool channelPool, EventCodec codec, EventBusProperties properties) {
        return new DefaultEventPublisher(channelPool, codec, properties.requireMicroservice());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditEmitter auditEmitter(ChannelPool channelPool, EventCodec codec, EventBusProperties properties) {
        return new AuditEmitter(channelPool, codec, properties.getAudit().toOptions());
    }
}
