package uk.gegc.coursesync.features.cartridge.domain.model;

import java.util.List;

public record ManifestModule(String identifier, String title, List<ManifestModuleItem> items) {

    public ManifestModule {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
