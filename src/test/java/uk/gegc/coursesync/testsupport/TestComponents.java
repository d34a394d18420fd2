package uk.gegc.coursesync.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import uk.gegc.coursesync.features.asset.config.AssetRegistryProperties;
import uk.gegc.coursesync.features.asset.infra.AssetRegistryRepository;
import uk.gegc.coursesync.features.cartridge.application.CartridgeExporter;
import uk.gegc.coursesync.features.cartridge.application.CartridgeImporter;
import uk.gegc.coursesync.features.cartridge.application.matcher.ResourceClassifier;
import uk.gegc.coursesync.features.cartridge.application.placement.QuizPlacementPolicy;
import uk.gegc.coursesync.features.cartridge.config.CartridgeProperties;
import uk.gegc.coursesync.features.cartridge.infra.CanvasSettingsReader;
import uk.gegc.coursesync.features.cartridge.infra.CanvasSettingsWriter;
import uk.gegc.coursesync.features.cartridge.infra.ManifestParser;
import uk.gegc.coursesync.features.cartridge.infra.QtiReader;
import uk.gegc.coursesync.features.cartridge.infra.QtiWriter;
import uk.gegc.coursesync.features.cartridge.infra.SafeArchiveExtractor;
import uk.gegc.coursesync.features.markup.application.HtmlToMarkdownConverter;
import uk.gegc.coursesync.features.markup.application.MarkdownRenderer;
import uk.gegc.coursesync.features.markup.application.MarkupNormalizer;
import uk.gegc.coursesync.features.markup.application.PlaceholderExpander;
import uk.gegc.coursesync.features.markup.application.PlatformWrapperStripper;
import uk.gegc.coursesync.features.markup.application.placeholder.SharedContentLoader;
import uk.gegc.coursesync.features.markup.application.template.TemplateLoader;
import uk.gegc.coursesync.features.markup.application.template.TemplateStripper;
import uk.gegc.coursesync.features.rubric.application.RubricDeduplicator;
import uk.gegc.coursesync.features.source.application.CourseSourceReader;
import uk.gegc.coursesync.features.source.application.CourseSourceWriter;
import uk.gegc.coursesync.features.source.application.FrontMatterCodec;
import uk.gegc.coursesync.features.source.application.QuizTextCodec;
import uk.gegc.coursesync.features.source.application.RubricYamlCodec;
import uk.gegc.coursesync.shared.config.JacksonConfig;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Wires real collaborators by hand for tests that exercise several components together without a Spring context.
 */
public final class TestComponents {

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    private TestComponents() {
    }

    public static ObjectMapper jsonMapper() {
        return JacksonConfig.jsonMapper();
    }

    public static YAMLMapper yamlMapper() {
        return JacksonConfig.yamlMapperInstance();
    }

    public static MarkupNormalizer markupNormalizer() {
        MarkdownRenderer renderer = new MarkdownRenderer();
        return new MarkupNormalizer(renderer, new HtmlToMarkdownConverter(), new PlaceholderExpander(),
                new PlatformWrapperStripper(), new TemplateStripper(renderer));
    }

    public static CourseSourceReader sourceReader() {
        YAMLMapper yaml = yamlMapper();
        return new CourseSourceReader(new FrontMatterCodec(yaml), new QuizTextCodec(), new RubricYamlCodec(yaml), yaml);
    }

    public static CourseSourceWriter sourceWriter() {
        YAMLMapper yaml = yamlMapper();
        return new CourseSourceWriter(new FrontMatterCodec(yaml), new QuizTextCodec(), new RubricYamlCodec(yaml));
    }

    public static RubricDeduplicator rubricDeduplicator() {
        return new RubricDeduplicator(jsonMapper());
    }

    public static AssetRegistryRepository registryRepository() {
        return new AssetRegistryRepository(jsonMapper(), new AssetRegistryProperties(), FIXED_CLOCK);
    }

    public static CartridgeExporter exporter() {
        return new CartridgeExporter(markupNormalizer(), new TemplateLoader(), new SharedContentLoader(yamlMapper()),
                new QtiWriter(), new CanvasSettingsWriter(), new AssetRegistryProperties());
    }

    public static CartridgeImporter importer() {
        return importer(new CartridgeProperties());
    }

    public static CartridgeImporter importer(CartridgeProperties properties) {
        return new CartridgeImporter(new SafeArchiveExtractor(properties), new ManifestParser(),
                ResourceClassifier.withDefaultMatchers(), new QuizPlacementPolicy(),
                new QtiReader(new HtmlToMarkdownConverter()), new CanvasSettingsReader(), markupNormalizer());
    }
}
