package uk.gegc.coursesync.features.cartridge.domain.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed {@code imsmanifest.xml}: course title, module tree and resources by identifier in
 * document order.
 */
public record CartridgeManifest(String title, List<ManifestModule> modules, Map<String, ManifestResource> resources) {

    public Optional<ManifestResource> resource(String identifier) {
        return Optional.ofNullable(resources.get(identifier));
    }

    /**
     * Title given to {@code identifier} by the first module item pointing at it.
     */
    public Optional<String> moduleItemTitle(String identifier) {
        return modules.stream()
                .flatMap(m -> m.items().stream())
                .filter(i -> identifier.equals(i.identifierRef()))
                .map(ManifestModuleItem::title)
                .filter(t -> t != null && !t.isBlank())
                .findFirst();
    }

    public boolean isReferencedByModule(String identifier) {
        return modules.stream().flatMap(m -> m.items().stream()).anyMatch(i -> identifier.equals(i.identifierRef()));
    }
}
