package uk.gegc.coursesync.features.cartridge.domain.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * One {@code <resource>} entry of the manifest.
 */
public record ManifestResource(String identifier, String type, String href, List<String> files,
                               List<String> dependencies) {

    public ManifestResource {
        type = type == null ? "" : type;
        files = files == null ? List.of() : List.copyOf(files);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public boolean typeContains(String fragment) {
        return type.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
    }

    public Optional<String> fileEndingWith(String suffix) {
        if (href != null && href.endsWith(suffix)) {
            return Optional.of(href);
        }
        return files.stream().filter(f -> f.endsWith(suffix)).findFirst();
    }

    public boolean hasFileEndingWith(String suffix) {
        return fileEndingWith(suffix).isPresent();
    }

    /**
     * The main file: {@code href} when declared, else the first listed file.
     */
    public Optional<String> primaryFile() {
        if (href != null && !href.isBlank()) {
            return Optional.of(href);
        }
        return files.stream().findFirst();
    }
}
