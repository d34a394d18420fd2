package uk.gegc.coursesync.features.canvas.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "app.canvas")
public class CanvasProperties {

    /**
     * Instance root without {@code /api/v1}, e.g. https://school.instructure.com
     */
    @NotBlank(message = "Property app.canvas.base-url must be configured")
    private String baseUrl = "https://canvas.instructure.com";

    /**
     * Only needed for runs that talk to the platform.
     */
    private String apiToken = "";

    @NotNull
    @Min(value = 1, message = "app.canvas.per-page must be at least 1")
    @Max(value = 100, message = "app.canvas.per-page must be at most 100")
    private Integer perPage = 100;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(60);

    /**
     * Course folder uploads are placed in.
     */
    @NotBlank
    private String uploadFolder = "coursesync";

    public String apiBase() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base.endsWith("/api/v1") ? base : base + "/api/v1";
    }

    public boolean hasToken() {
        return apiToken != null && !apiToken.isBlank();
    }
}
