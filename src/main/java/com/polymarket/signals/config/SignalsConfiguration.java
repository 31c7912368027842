package com.polymarket.signals.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymarket.signals.infra.MarketEventLoop;
import okhttp3.ConnectionSpec;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

@Configuration
public class SignalsConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean(destroyMethod = "shutdown")
    public MarketEventLoop marketEventLoop() {
        return new MarketEventLoop();
    }

    /**
     * Shared by the market socket and the REST fallback. The read timeout is
     * disabled so the long-lived socket is not cut; REST calls are bounded by
     * the call timeout instead.
     */
    @Bean
    public OkHttpClient okHttpClient() {
        ConnectionSpec tls = new ConnectionSpec.Builder(ConnectionSpec.MODERN_TLS)
                .allEnabledTlsVersions()
                .allEnabledCipherSuites()
                .build();
        return new OkHttpClient.Builder()
                .connectionSpecs(Arrays.asList(tls, ConnectionSpec.CLEARTEXT))
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(0, TimeUnit.SECONDS)
                .callTimeout(60, TimeUnit.SECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }
}
