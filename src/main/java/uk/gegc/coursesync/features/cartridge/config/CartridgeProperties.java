package uk.gegc.coursesync.features.cartridge.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Limits applied while extracting an imported archive.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "app.cartridge")
public class CartridgeProperties {

    @NotNull(message = "Property app.cartridge.max-total-bytes must be configured")
    @Min(value = 1, message = "app.cartridge.max-total-bytes must be positive")
    private Long maxTotalBytes = 500L * 1024 * 1024;

    @NotNull(message = "Property app.cartridge.max-entry-bytes must be configured")
    @Min(value = 1, message = "app.cartridge.max-entry-bytes must be positive")
    private Long maxEntryBytes = 50L * 1024 * 1024;

    @NotNull(message = "Property app.cartridge.max-entries must be configured")
    @Min(value = 1, message = "app.cartridge.max-entries must be positive")
    private Integer maxEntries = 10_000;

    @NotNull(message = "Property app.cartridge.max-compression-ratio must be configured")
    @Min(value = 1, message = "app.cartridge.max-compression-ratio must be at least 1")
    private Integer maxCompressionRatio = 100;
}
