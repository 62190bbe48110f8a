package com.shipyard.preview;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class PreviewConfig {

    @Bean
    @ConditionalOnMissingBean(PortProbe.class)
    public SocketPortProbe socketPortProbe(PreviewProperties properties) {
        return new SocketPortProbe(Duration.ofMillis(properties.getProbeTimeoutMillis()));
    }

    @Bean
    @ConditionalOnMissingBean(PreviewLauncher.class)
    public LocalProcessLauncher localProcessLauncher() {
        return new LocalProcessLauncher();
    }

    /** Connect timeout equals the poll interval. */
    @Bean
    @ConditionalOnMissingBean(ReadinessProbe.class)
    public TcpReadinessProbe tcpReadinessProbe(PreviewProperties properties) {
        return new TcpReadinessProbe(Duration.ofMillis(properties.getReadinessPollMillis()));
    }
}
