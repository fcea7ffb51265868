/**
 * Configuration for the WebClient used by the bibliographic providers
 * - Defines the shared WebClient.Builder bean
 * - Sets connect, read and write timeouts on the Netty client
 * - Logs every provider response status through ExternalApiLogger
 *
 * @author William Callahan
 */
package com.williamcallahan.shelf_scan.config;

import com.williamcallahan.shelf_scan.util.ExternalApiLogger;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Connection timeout 5000ms
     * - Read, write and response timeouts 5 seconds
     * - 2MB in-memory buffer, enough for single-result search payloads
     *
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(5, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(5, TimeUnit.SECONDS))
            )
            .responseTimeout(Duration.ofSeconds(5));

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(2 * 1024 * 1024))
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .filter(responseLoggingFilter())
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }

    static ExchangeFilterFunction responseLoggingFilter() {
        return (request, next) -> next.exchange(request)
            .doOnNext(response -> ExternalApiLogger.logHttpResponse(
                logger, response.statusCode().value(), request.url().toString()));
    }
}
