package uk.gegc.coursesync.features.cartridge.infra;

import lombok.extern.slf4j.Slf4j;
import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.cartridge.domain.model.CartridgeManifest;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestModule;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestModuleItem;
import uk.gegc.coursesync.features.cartridge.domain.model.ManifestResource;
import uk.gegc.coursesync.shared.exception.ArchiveFormatException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.LOM_MANIFEST;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.MANIFEST;

@Slf4j
@Component
public class ManifestParser {

    private static final String[] NS = MANIFEST.toArray(String[]::new);

    public CartridgeManifest parse(Path manifestFile) {
        if (!Files.isRegularFile(manifestFile)) {
            throw new ArchiveFormatException("No " + manifestFile.getFileName() + " found in archive");
        }
        Document document;
        try {
            document = XmlSupport.read(manifestFile);
        } catch (DocumentException | IOException ex) {
            throw new ArchiveFormatException("Unparsable manifest: " + ex.getMessage(), ex);
        }
        Element root = document.getRootElement();
        if (!"manifest".equals(root.getName())) {
            throw new ArchiveFormatException("Manifest root element is <" + root.getName() + ">, expected <manifest>");
        }

        String title = XmlSupport.descendant(root, "title", LOM_MANIFEST)
                .flatMap(t -> XmlSupport.descendantText(t, "string", LOM_MANIFEST))
                .orElse(null);

        Map<String, ManifestResource> resources = new LinkedHashMap<>();
        XmlSupport.child(root, "resources", NS).ifPresent(list -> {
            for (Element element : XmlSupport.children(list, "resource", NS)) {
                String identifier = element.attributeValue("identifier");
                if (identifier == null || identifier.isBlank()) {
                    log.warn("Ignoring manifest resource without identifier");
                    continue;
                }
                List<String> files = XmlSupport.children(element, "file", NS).stream()
                        .map(f -> f.attributeValue("href"))
                        .filter(h -> h != null && !h.isBlank())
                        .toList();
                List<String> dependencies = XmlSupport.children(element, "dependency", NS).stream()
                        .map(d -> d.attributeValue("identifierref"))
                        .filter(h -> h != null && !h.isBlank())
                        .toList();
                resources.put(identifier, new ManifestResource(identifier, element.attributeValue("type"),
                        element.attributeValue("href"), files, dependencies));
            }
        });

        List<ManifestModule> modules = parseModules(root);
        log.info("Parsed manifest: {} resources, {} modules", resources.size(), modules.size());
        return new CartridgeManifest(title, modules, resources);
    }

    private List<ManifestModule> parseModules(Element root) {
        Element organization = XmlSupport.child(root, "organizations", NS)
                .flatMap(o -> XmlSupport.child(o, "organization", NS))
                .orElse(null);
        if (organization == null) {
            return List.of();
        }
        List<Element> top = XmlSupport.children(organization, "item", NS);
        // a single reference-less root item wraps the modules
        if (top.size() == 1 && top.get(0).attributeValue("identifierref") == null
                && XmlSupport.children(top.get(0), "item", NS).stream().allMatch(i -> i.attributeValue("identifierref") == null)) {
            top = XmlSupport.children(top.get(0), "item", NS);
        }
        List<ManifestModule> modules = new ArrayList<>();
        for (Element module : top) {
            String identifier = module.attributeValue("identifier");
            String title = XmlSupport.childText(module, "title", NS).orElse(identifier);
            List<ManifestModuleItem> items = new ArrayList<>();
            collectItems(module, items);
            modules.add(new ManifestModule(identifier, title, items));
        }
        return modules;
    }

    /**
     * Flattens nested sub-headers into the module's item list. A leaf entry without a resource reference
     * is kept with a null reference so the importer can report it.
     */
    private void collectItems(Element parent, List<ManifestModuleItem> items) {
        for (Element item : XmlSupport.children(parent, "item", NS)) {
            String ref = item.attributeValue("identifierref");
            List<Element> nested = XmlSupport.children(item, "item", NS);
            boolean hasRef = ref != null && !ref.isBlank();
            if (hasRef || nested.isEmpty()) {
                items.add(new ManifestModuleItem(item.attributeValue("identifier"), hasRef ? ref : null,
                        XmlSupport.childText(item, "title", NS).orElse(null)));
            }
            collectItems(item, items);
        }
    }
}
