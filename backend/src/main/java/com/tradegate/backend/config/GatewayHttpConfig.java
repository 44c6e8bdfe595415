package com.tradegate.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class GatewayHttpConfig {

    @Bean
    public RestTemplate gatewayRestTemplate(TradingProperties tradingProperties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(tradingProperties.getGateway().getConnectTimeoutMs());
        factory.setReadTimeout(tradingProperties.getGateway().getReadTimeoutMs());
        return new RestTemplate(factory);
    }
}
