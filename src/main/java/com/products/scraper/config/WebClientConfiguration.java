package com.products.scraper.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

/**
 * Builds the two {@link WebClient}s the scraper uses: one for the target
 * site (raw HTML fetches and challenge images) and one for the captcha
 * solving provider.
 */
@Configuration
@Slf4j
public class WebClientConfiguration {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private static final Duration POOL_ACQUIRE_TIMEOUT = Duration.ofMillis(2000);

    private static final int MAX_CONNECTIONS = 50;

    /** Search result pages run to a few megabytes; the codec default is 256 KB. */
    private static final int MAX_IN_MEMORY_SIZE = 8 * 1024 * 1024;

    @Bean
    @Qualifier("targetWebClient")
    public WebClient targetWebClient(final WebClient.Builder builder,
                                     final ScraperProperties props) {

        HttpClient httpClient = HttpClient.create(pool("target-pool"))
                .protocol(HttpProtocol.HTTP11)
                .compress(true)
                .followRedirect(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) CONNECT_TIMEOUT.toMillis())
                .responseTimeout(props.getTimeouts().getRawFetch())
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);

        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(largeBodies())
                .filter(logRequest())
                .filter(logResponse())
                .build();
    }

    @Bean
    @Qualifier("captchaWebClient")
    public WebClient captchaWebClient(final WebClient.Builder builder,
                                      final ScraperProperties props) {

        HttpClient httpClient = HttpClient.create(pool("captcha-pool"))
                .protocol(HttpProtocol.H2, HttpProtocol.HTTP11)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) CONNECT_TIMEOUT.toMillis())
                .responseTimeout(Duration.ofSeconds(30));

        return builder.clone()
                .baseUrl(props.getCaptcha().getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .filter(logRequest())
                .filter(logResponse())
                .build();
    }

    private static ConnectionProvider pool(final String name) {
        return ConnectionProvider.builder(name)
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(POOL_ACQUIRE_TIMEOUT)
                .build();
    }

    private static ExchangeStrategies largeBodies() {
        return ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}  {}", req.method(), req.url(), req.headers());
            return Mono.just(req);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            log.debug("<-- {}  {}", res.statusCode().value(), res.headers().asHttpHeaders());
            return Mono.just(res);
        });
    }
}
