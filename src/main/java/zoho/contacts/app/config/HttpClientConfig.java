package zoho.contacts.app.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestTemplate;
import zoho.contacts.app.service.Sleeper;

import java.time.Clock;

/**
 * HTTP client and timing beans shared by the token, request and attachment services.
 */
@Configuration
@EnableConfigurationProperties(ExtractorProperties.class)
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, ExtractorProperties properties) {
        return builder
                .setConnectTimeout(properties.getRequest().getTimeout())
                .setReadTimeout(properties.getRequest().getTimeout())
                .errorHandler(new PassThroughErrorHandler())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Sleeper sleeper() {
        return Thread::sleep;
    }

    /**
     * Hands every status code back to the caller; status classification happens in
     * {@link zoho.contacts.app.service.ApiRequestExecutor}.
     */
    static class PassThroughErrorHandler extends DefaultResponseErrorHandler {
        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }
    }
}
