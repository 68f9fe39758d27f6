package com.tony.decisionQuality.config;

import com.tony.decisionQuality.client.ConnectorRegistry;
import com.tony.decisionQuality.client.LiveClientStub;
import com.tony.decisionQuality.client.NullLiveClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Registre explicite des clients de source. Aucun client réseau réel n'est branché ici.
     */
    @Bean
    public ConnectorRegistry connectorRegistry() {
        ConnectorRegistry registry = new ConnectorRegistry();
        registry.register(new NullLiveClient());
        registry.register(new LiveClientStub());
        return registry;
    }
}
