package com.fintech.papertrading.config;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Pooled HTTP client for the price feed. One route per asset poller, so the pool stays small.
 */
@Configuration
public class HttpClientConfig {

    @Bean(destroyMethod = "close")
    public PoolingHttpClientConnectionManager priceFeedConnectionManager() {
        PoolingHttpClientConnectionManager manager = new PoolingHttpClientConnectionManager();
        manager.setMaxTotal(20);
        manager.setDefaultMaxPerRoute(10);
        return manager;
    }

    @Bean(destroyMethod = "close")
    public CloseableHttpClient priceFeedHttpClient(
            PoolingHttpClientConnectionManager priceFeedConnectionManager,
            TradingProperties properties) {
        TradingProperties.Feed feed = properties.getFeed();
        RequestConfig config = RequestConfig.custom()
            .setConnectTimeout(Timeout.ofMilliseconds(feed.getConnectTimeout().toMillis()))
            .setConnectionRequestTimeout(Timeout.ofMilliseconds(feed.getConnectTimeout().toMillis()))
            .setResponseTimeout(Timeout.ofMilliseconds(feed.getResponseTimeout().toMillis()))
            .build();

        return HttpClients.custom()
            .setConnectionManager(priceFeedConnectionManager)
            .setDefaultRequestConfig(config)
            .evictExpiredConnections()
            .evictIdleConnections(Timeout.ofSeconds(30))
            .build();
    }

    @Bean
    @Qualifier("priceFeedRestTemplate")
    public RestTemplate priceFeedRestTemplate(CloseableHttpClient priceFeedHttpClient) {
        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(priceFeedHttpClient));
    }
}
