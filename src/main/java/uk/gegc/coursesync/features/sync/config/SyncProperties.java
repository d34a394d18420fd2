package uk.gegc.coursesync.features.sync.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "app.sync")
public class SyncProperties {

    @NotNull(message = "Property app.sync.parallelism must be configured")
    @Min(value = 1, message = "app.sync.parallelism must be at least 1")
    @Max(value = 64, message = "app.sync.parallelism must be at most 64")
    private Integer parallelism = 4;

    @NotNull(message = "Property app.sync.queue-capacity must be configured")
    @Min(value = 1, message = "app.sync.queue-capacity must be positive")
    private Integer queueCapacity = 100;

    /**
     * Template set used when neither the item nor {@code course.yaml} names one.
     */
    private String templateSet;

    /**
     * Drop registry paths whose files no longer exist once publishing is done.
     */
    private boolean prune = false;

    /**
     * Also write a Common Cartridge archive of the course at the end of a sync.
     */
    private boolean packageOnSync = false;

    @NotBlank(message = "Property app.sync.package-dir must be configured")
    private String packageDir = "_course_metadata/exports";

    private boolean dumpRunCache = false;

    @NotBlank(message = "Property app.sync.run-cache-path must be configured")
    private String runCachePath = "_course_metadata/run_cache.json";
}
