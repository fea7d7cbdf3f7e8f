package vn.com.fecredit.flowable.layout.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import vn.com.fecredit.flowable.layout.engine.AdjacentSameLaneRoutingPolicy;
import vn.com.fecredit.flowable.layout.engine.GatewayLanePolicy;
import vn.com.fecredit.flowable.layout.engine.LayoutEngine;
import vn.com.fecredit.flowable.layout.engine.LayoutSettings;
import vn.com.fecredit.flowable.layout.engine.PredecessorFirstLanePolicy;
import vn.com.fecredit.flowable.layout.engine.RoutingPolicy;
import vn.com.fecredit.flowable.layout.service.FlowDocumentReader;

/**
 * Wires the layout engine from {@code flow.layout.*} properties. Both policies can be
 * replaced by declaring a bean of the same type.
 */
@Configuration
@EnableConfigurationProperties(LayoutProperties.class)
public class LayoutEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LayoutEngineConfiguration.class);

    @Bean
    public LayoutSettings layoutSettings(LayoutProperties properties) {
        LayoutSettings settings = properties.toSettings();
        log.info("Layout settings: {}", settings);
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean
    public GatewayLanePolicy gatewayLanePolicy() {
        return new PredecessorFirstLanePolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public RoutingPolicy routingPolicy() {
        return new AdjacentSameLaneRoutingPolicy();
    }

    @Bean
    public LayoutEngine layoutEngine(LayoutSettings settings, GatewayLanePolicy lanePolicy, RoutingPolicy routingPolicy) {
        return new LayoutEngine(settings, lanePolicy, routingPolicy);
    }

    @Bean
    public FlowDocumentReader flowDocumentReader(ObjectProvider<ObjectMapper> objectMapper) {
        return new FlowDocumentReader(objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
