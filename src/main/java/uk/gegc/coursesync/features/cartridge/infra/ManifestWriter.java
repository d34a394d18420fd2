package uk.gegc.coursesync.features.cartridge.infra;

import org.dom4j.Document;
import org.dom4j.DocumentHelper;
import org.dom4j.Element;
import org.dom4j.Namespace;
import org.dom4j.QName;

import java.util.List;

import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.IMSCC_1_1;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.LOM_MANIFEST;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.LOM_RESOURCE;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.XSI;

/**
 * Builds {@code imsmanifest.xml}: LOM title, a rooted organization holding one item per module, and
 * the resource list. Every archive member that a conforming importer should see has to be listed here.
 */
public class ManifestWriter {

    private final Document document;
    private final Element learningModules;
    private final Element resources;

    public ManifestWriter(String identifier, String title) {
        document = DocumentHelper.createDocument();
        Element manifest = document.addElement("manifest", IMSCC_1_1);
        manifest.addNamespace("lom", LOM_RESOURCE);
        manifest.addNamespace("lomimscc", LOM_MANIFEST);
        manifest.addNamespace("xsi", XSI);
        manifest.addAttribute("identifier", identifier);
        manifest.addAttribute(QName.get("schemaLocation", Namespace.get("xsi", XSI)),
                IMSCC_1_1 + " http://www.imsglobal.org/profile/cc/ccv1p1/ccv1p1_imscp_v1p2_v1p0.xsd");

        Element metadata = manifest.addElement("metadata", IMSCC_1_1);
        XmlSupport.addText(metadata, "schema", "IMS Common Cartridge");
        XmlSupport.addText(metadata, "schemaversion", "1.1.0");
        metadata.addElement(QName.get("lom", "lomimscc", LOM_MANIFEST))
                .addElement(QName.get("general", "lomimscc", LOM_MANIFEST))
                .addElement(QName.get("title", "lomimscc", LOM_MANIFEST))
                .addElement(QName.get("string", "lomimscc", LOM_MANIFEST))
                .setText(title);

        Element organization = manifest.addElement("organizations", IMSCC_1_1)
                .addElement("organization", IMSCC_1_1)
                .addAttribute("identifier", "org_1")
                .addAttribute("structure", "rooted-hierarchy");
        learningModules = organization.addElement("item", IMSCC_1_1).addAttribute("identifier", "LearningModules");
        resources = manifest.addElement("resources", IMSCC_1_1);
    }

    public Element addModule(String identifier, String title) {
        Element module = learningModules.addElement("item", IMSCC_1_1).addAttribute("identifier", identifier);
        XmlSupport.addText(module, "title", title);
        return module;
    }

    public void addModuleItem(Element module, String identifier, String identifierRef, String title) {
        Element item = module.addElement("item", IMSCC_1_1)
                .addAttribute("identifier", identifier)
                .addAttribute("identifierref", identifierRef);
        XmlSupport.addText(item, "title", title);
    }

    public void addResource(String identifier, String type, String href, List<String> files, List<String> dependencies) {
        Element resource = resources.addElement("resource", IMSCC_1_1)
                .addAttribute("identifier", identifier)
                .addAttribute("type", type);
        if (href != null) {
            resource.addAttribute("href", href);
        }
        for (String file : files) {
            resource.addElement("file", IMSCC_1_1).addAttribute("href", file);
        }
        for (String dependency : dependencies) {
            resource.addElement("dependency", IMSCC_1_1).addAttribute("identifierref", dependency);
        }
    }

    public byte[] toBytes() {
        return XmlSupport.toBytes(document);
    }
}
