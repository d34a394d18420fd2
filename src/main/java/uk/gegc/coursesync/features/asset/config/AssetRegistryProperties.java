package uk.gegc.coursesync.features.asset.config;

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
@ConfigurationProperties(prefix = "app.assets")
public class AssetRegistryProperties {

    @NotBlank(message = "Property app.assets.registry-path must be configured")
    private String registryPath = "_course_metadata/asset_registry.json";

    @NotBlank(message = "Property app.assets.shared-dir must be configured")
    private String sharedDir = "assets";

    @NotNull(message = "Property app.assets.key-length must be configured")
    @Min(value = 8, message = "app.assets.key-length must be at least 8")
    @Max(value = 32, message = "app.assets.key-length must be at most 32")
    private Integer keyLength = 12;
}
