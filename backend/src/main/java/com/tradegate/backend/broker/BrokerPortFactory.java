package com.tradegate.backend.broker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradegate.backend.config.TradingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds fresh broker ports. The application uses one from {@code BrokerConfiguration}; the
 * validation harness asks for its own so it never disturbs the live session.
 */
@Component
@RequiredArgsConstructor
public class BrokerPortFactory {

    private final TradingProperties tradingProperties;
    private final GatewayHttpClient gatewayHttpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BrokerPort create(boolean dryRun) {
        return dryRun ? simulated() : gateway();
    }

    public SimulatedBrokerPort simulated() {
        TradingProperties.Simulation simulation = tradingProperties.getSimulation();
        QuoteSource quotes = simulation.isGatewayQuotes() ? gateway()::quote : null;
        return new SimulatedBrokerPort(simulation, quotes, clock);
    }

    public GatewayBrokerPort gateway() {
        return new GatewayBrokerPort(gatewayHttpClient, objectMapper, tradingProperties, clock);
    }
}
