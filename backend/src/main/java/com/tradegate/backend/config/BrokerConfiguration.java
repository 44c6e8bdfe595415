package com.tradegate.backend.config;

import com.tradegate.backend.broker.BrokerPort;
import com.tradegate.backend.broker.BrokerPortFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class BrokerConfiguration {

    @Bean(destroyMethod = "disconnect")
    public BrokerPort brokerPort(BrokerPortFactory factory, TradingProperties tradingProperties) {
        if (tradingProperties.isDryRun()) {
            log.info("Trading mode: DRY RUN (simulated fills, no real orders), default market {}",
                    tradingProperties.getDefaultMarket());
        } else {
            log.warn("Trading mode: LIVE - orders will be sent to {}, default market {}",
                    tradingProperties.gatewayBaseUrl(), tradingProperties.getDefaultMarket());
        }
        return factory.create(tradingProperties.isDryRun());
    }
}
