package com.tradegate.backend.broker;

import com.tradegate.backend.config.TradingProperties;
import com.tradegate.backend.exception.GatewayApiException;
import com.tradegate.backend.exception.GatewayCircuitOpenException;
import com.tradegate.backend.service.MetricsService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.function.Supplier;

/**
 * Raw JSON transport to the broker gateway. Calls pass through a rate limiter and a circuit
 * breaker; nothing is retried because order placement is not idempotent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayHttpClient {

    private final RestTemplate gatewayRestTemplate;
    private final CircuitBreaker gatewayCircuitBreaker;
    private final RateLimiter gatewayRateLimiter;
    private final TradingProperties tradingProperties;
    private final MetricsService metricsService;
    private final MeterRegistry meterRegistry;

    @PostConstruct
    void init() {
        gatewayCircuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Gateway circuit breaker {}", event.getStateTransition()));
        Gauge.builder("broker_circuit_state", gatewayCircuitBreaker, breaker -> mapState(breaker.getState()))
                .tag("broker", "GATEWAY")
                .register(meterRegistry);
    }

    public String get(String path) {
        return execute(path, HttpMethod.GET, null);
    }

    public String post(String path, String body) {
        return execute(path, HttpMethod.POST, body);
    }

    public String delete(String path) {
        return execute(path, HttpMethod.DELETE, null);
    }

    private String execute(String path, HttpMethod method, String body) {
        String url = tradingProperties.gatewayBaseUrl() + path;
        long started = System.nanoTime();
        boolean success = false;
        Supplier<String> supplier = () -> doRequest(url, method, body);
        try {
            Supplier<String> decorated = CircuitBreaker.decorateSupplier(gatewayCircuitBreaker, supplier);
            decorated = RateLimiter.decorateSupplier(gatewayRateLimiter, decorated);
            String response = decorated.get();
            success = true;
            return response;
        } catch (CallNotPermittedException e) {
            metricsService.incrementBrokerFailures();
            log.warn("Gateway circuit open, {} {} not sent", method, url);
            throw new GatewayCircuitOpenException("Gateway circuit breaker open", e);
        } catch (RequestNotPermitted e) {
            metricsService.incrementBrokerFailures();
            log.warn("Gateway rate limit reached for {} {}", method, url);
            throw new GatewayApiException("Gateway rate limit reached", 429, e);
        } catch (RuntimeException e) {
            metricsService.incrementBrokerFailures();
            log.warn("Gateway request failed method={} url={} message={}", method, url, e.getMessage());
            throw e;
        } finally {
            metricsService.recordBrokerLatency(method.name() + " " + templateOf(path), System.nanoTime() - started, success);
        }
    }

    private String doRequest(String url, HttpMethod method, String body) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            if (body != null) {
                headers.setContentType(MediaType.APPLICATION_JSON);
            }
            HttpEntity<String> entity = new HttpEntity<>(body, headers);
            ResponseEntity<String> response = gatewayRestTemplate.exchange(url, method, entity, String.class);
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            throw new GatewayApiException("Gateway error (" + status + "): " + e.getResponseBodyAsString(), status, e);
        } catch (ResourceAccessException e) {
            throw new GatewayApiException("Gateway unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new GatewayApiException("Gateway call failed: " + e.getMessage(), e);
        }
    }

    private String templateOf(String path) {
        int query = path.indexOf('?');
        String bare = query >= 0 ? path.substring(0, query) : path;
        return bare.replaceAll("/orders/[^/]+", "/orders/{id}").replaceAll("/accounts/[^/]+", "/accounts/{id}");
    }

    private int mapState(CircuitBreaker.State state) {
        return switch (state) {
            case CLOSED -> 0;
            case OPEN -> 1;
            case HALF_OPEN -> 2;
            default -> 3;
        };
    }
}
