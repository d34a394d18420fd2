package uk.gegc.coursesync.features.cartridge.domain.model;

/**
 * Per-item annotation from {@code module_meta.xml}.
 */
public record ModuleMetaEntry(String moduleIdentifier, String identifierRef, String contentType, int indent,
                              boolean published, String url, Boolean newTab) {
}
