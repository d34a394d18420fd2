package uk.gegc.coursesync.features.cartridge.domain.model;

public record ManifestModuleItem(String identifier, String identifierRef, String title) {
}
