package uk.gegc.coursesync.features.asset.domain.model;

public record RegistryStats(int assets, int paths, long totalBytes) {
}
