package com.ehrgateway.config;

import java.time.Duration;

import javax.net.ssl.SSLException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import com.ehrgateway.openemr.OpenEmrClient;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import reactor.netty.http.client.HttpClient;

/**
 * OpenEMR upstream configuration
 *
 * Builds the single WebClient used for the OAuth 2.0 endpoints
 * (/oauth2/default) and the FHIR / Standard APIs (/apis/default).
 */
@Configuration
public class OpenEmrConfig {

    @Value("${openemr.base-url:https://localhost:9300}")
    private String baseUrl;

    @Value("${openemr.verify-ssl:false}")
    private boolean verifySsl;

    @Value("${openemr.timeout:30s}")
    private Duration timeout;

    @Bean
    public WebClient openEmrWebClient(WebClient.Builder webClientBuilder) throws SSLException {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
                .responseTimeout(timeout);

        if (!verifySsl) {
            SslContext insecure = SslContextBuilder.forClient()
                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                    .build();
            httpClient = httpClient.secure(spec -> spec.sslContext(insecure));
        }

        return webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Bean
    public OpenEmrClient openEmrClient(WebClient openEmrWebClient, ObjectMapper objectMapper) {
        return new OpenEmrClient(openEmrWebClient, objectMapper, baseUrl, timeout);
    }
}
