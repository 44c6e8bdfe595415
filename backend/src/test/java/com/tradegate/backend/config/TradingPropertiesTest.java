package com.tradegate.backend.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TradingPropertiesTest {

    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    @Test
    void defaultsAreSafe() {
        TradingProperties properties = new TradingProperties();

        assertThat(properties.isDryRun()).isTrue();
        assertThat(properties.isEnableLiveTrading()).isFalse();
        assertThat(properties.isEnableShortSelling()).isFalse();
        assertThat(properties.getMaxOrderValue()).isEqualByComparingTo("50000");
        assertThat(validator.validate(properties)).isEmpty();
    }

    @Test
    void liveTradingSwitchInvertsDryRun() {
        TradingProperties properties = new TradingProperties();

        properties.setEnableLiveTrading(true);

        assertThat(properties.isDryRun()).isFalse();
    }

    @Test
    void gatewayUrlDerivesFromHostAndPort() {
        TradingProperties properties = new TradingProperties();
        properties.setHost("10.0.0.5");
        properties.setPort(22222);

        assertThat(properties.gatewayBaseUrl()).isEqualTo("http://10.0.0.5:22222/api/v1");

        properties.getGateway().setBaseUrl("http://gateway.local/api/v1");
        assertThat(properties.gatewayBaseUrl()).isEqualTo("http://gateway.local/api/v1");
    }

    @Test
    void outOfRangePortFailsValidation() {
        TradingProperties properties = new TradingProperties();
        properties.setPort(70000);

        assertThat(validator.validate(properties))
                .extracting(violation -> violation.getPropertyPath().toString())
                .containsExactly("port");
    }

    @Test
    void unknownLogLevelFailsValidation() {
        TradingProperties properties = new TradingProperties();
        properties.setLogLevel("VERBOSE");

        assertThat(validator.validate(properties))
                .extracting(violation -> violation.getPropertyPath().toString())
                .containsExactly("logLevel");
    }
}
