package uk.gegc.coursesync.features.canvas.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestClient;

@Configuration
@Slf4j
public class CanvasClientConfig {

    @Bean(name = "canvasRestClient")
    public RestClient canvasRestClient(CanvasProperties properties, ObjectMapper objectMapper) {
        RestClient.Builder builder = RestClient.builder()
                .baseUrl(properties.apiBase())
                .requestFactory(requestFactory(properties))
                .messageConverters(converters -> {
                    converters.removeIf(MappingJackson2HttpMessageConverter.class::isInstance);
                    converters.add(new MappingJackson2HttpMessageConverter(objectMapper));
                });
        if (properties.hasToken()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiToken());
        } else {
            log.debug("No Canvas API token configured; remote operations will fail");
        }
        log.info("Canvas client configured for {}", properties.apiBase());
        return builder.build();
    }

    static SimpleClientHttpRequestFactory requestFactory(CanvasProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        return factory;
    }
}
