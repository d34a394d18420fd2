package uk.gegc.coursesync.features.cartridge.infra;

import lombok.RequiredArgsConstructor;
import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.cartridge.domain.model.DecodedAssessment;
import uk.gegc.coursesync.features.course.domain.model.AnswerChoice;
import uk.gegc.coursesync.features.course.domain.model.Question;
import uk.gegc.coursesync.features.course.domain.model.QuestionGroup;
import uk.gegc.coursesync.features.course.domain.model.QuestionType;
import uk.gegc.coursesync.features.markup.application.HtmlToMarkdownConverter;
import uk.gegc.coursesync.shared.exception.ResourceDecodeException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.QTI;

/**
 * Reads QTI 1.2 assessments and object banks from either file of an export, or from third-party
 * archives. Question types come from {@code cc_profile}, then {@code question_type}, then the shape of
 * the response element.
 */
@Component
@RequiredArgsConstructor
public class QtiReader {

    private final HtmlToMarkdownConverter htmlToMarkdown;

    public DecodedAssessment read(Path file, String resourceId) {
        if (!Files.isRegularFile(file)) {
            throw new ResourceDecodeException(resourceId, "missing assessment file " + file.getFileName());
        }
        Document document;
        try {
            document = XmlSupport.read(file);
        } catch (DocumentException | IOException ex) {
            throw new ResourceDecodeException(resourceId, "unparsable QTI: " + ex.getMessage(), ex);
        }
        Element root = document.getRootElement();

        Optional<Element> bank = "objectbank".equals(root.getName())
                ? Optional.of(root)
                : XmlSupport.descendant(root, "objectbank", QTI);
        if (bank.isPresent()) {
            Element element = bank.get();
            Map<String, String> metadata = metadata(element);
            String ident = element.attributeValue("ident", resourceId);
            String title = metadata.getOrDefault("bank_title", element.attributeValue("title", ident));
            return new DecodedAssessment(ident, title, "", items(element, resourceId), List.of(), metadata, true);
        }

        Element assessment = "assessment".equals(root.getName())
                ? root
                : XmlSupport.descendant(root, "assessment", QTI)
                .orElseThrow(() -> new ResourceDecodeException(resourceId, "no <assessment> or <objectbank> element"));
        String ident = assessment.attributeValue("ident", resourceId);
        String title = assessment.attributeValue("title", ident);
        String description = XmlSupport.child(assessment, "objectives", QTI)
                .flatMap(o -> XmlSupport.descendantText(o, "mattext", QTI))
                .orElse("");
        return new DecodedAssessment(ident, title, description, items(assessment, resourceId), groups(assessment),
                metadata(assessment), false);
    }

    /**
     * Metadata fields directly attached to {@code owner}, not those of its items.
     */
    private static Map<String, String> metadata(Element owner) {
        Map<String, String> fields = new LinkedHashMap<>();
        XmlSupport.child(owner, "qtimetadata", QTI).ifPresent(metadata -> {
            for (Element field : XmlSupport.children(metadata, "qtimetadatafield", QTI)) {
                Optional<String> label = XmlSupport.childText(field, "fieldlabel", QTI);
                Optional<String> entry = XmlSupport.childText(field, "fieldentry", QTI);
                if (label.isPresent() && entry.isPresent()) {
                    fields.put(label.get(), entry.get());
                }
            }
        });
        return fields;
    }

    private List<Question> items(Element owner, String resourceId) {
        List<Question> questions = new ArrayList<>();
        for (Element item : XmlSupport.descendants(owner, "item", QTI)) {
            readItem(item, resourceId).ifPresent(questions::add);
        }
        return questions;
    }

    private Optional<Question> readItem(Element item, String resourceId) {
        Map<String, String> metadata = XmlSupport.child(item, "itemmetadata", QTI)
                .map(QtiReader::metadata)
                .orElse(Map.of());
        Element presentation = XmlSupport.child(item, "presentation", QTI).orElse(null);
        if (presentation == null) {
            return Optional.empty();
        }
        Optional<Element> stem = XmlSupport.child(presentation, "material", QTI)
                .flatMap(m -> XmlSupport.child(m, "mattext", QTI));
        String text = stem.map(this::text).orElse("");
        if (text.isBlank()) {
            return Optional.empty();
        }

        Optional<Element> choice = XmlSupport.descendant(presentation, "response_lid", QTI);
        Optional<Element> string = XmlSupport.descendant(presentation, "response_str", QTI);
        QuestionType type = declaredType(metadata).orElseGet(() -> inferType(item, choice, string));

        List<AnswerChoice> answers = new ArrayList<>();
        if (type.hasChoices()) {
            Set<String> correct = correctIdents(item);
            for (Element label : choice.map(c -> XmlSupport.descendants(c, "response_label", QTI)).orElse(List.of())) {
                String answerText = XmlSupport.descendant(label, "mattext", QTI).map(this::text).orElse("");
                if (!answerText.isBlank()) {
                    answers.add(new AnswerChoice(answerText, correct.contains(label.attributeValue("ident"))));
                }
            }
        } else if (type == QuestionType.SHORT_ANSWER) {
            correctIdents(item).forEach(value -> answers.add(new AnswerChoice(value, true)));
        }

        Double points = points(metadata);
        try {
            return Optional.of(new Question(item.attributeValue("ident"), type, text, answers, points));
        } catch (IllegalArgumentException ex) {
            throw new ResourceDecodeException(resourceId, "invalid question " + item.attributeValue("ident") + ": " + ex.getMessage(), ex);
        }
    }

    private static Optional<QuestionType> declaredType(Map<String, String> metadata) {
        String profile = metadata.get("cc_profile");
        if (profile != null) {
            Optional<QuestionType> type = QuestionType.fromCcProfile(profile);
            if (type.isPresent()) {
                return type;
            }
        }
        String questionType = metadata.get("question_type");
        return questionType == null ? Optional.empty() : QuestionType.fromRemoteName(questionType);
    }

    private QuestionType inferType(Element item, Optional<Element> choice, Optional<Element> string) {
        if (choice.isPresent()) {
            boolean multiple = "multiple".equals(choice.get().attributeValue("rcardinality", "").toLowerCase(Locale.ROOT));
            return multiple ? QuestionType.MULTIPLE_ANSWERS : QuestionType.MULTIPLE_CHOICE;
        }
        if (string.isPresent()) {
            return correctIdents(item).isEmpty() ? QuestionType.ESSAY : QuestionType.SHORT_ANSWER;
        }
        return QuestionType.FILE_UPLOAD;
    }

    /**
     * Values compared in full-score conditions, leaving out negated ones.
     */
    private static Set<String> correctIdents(Element item) {
        Set<String> correct = new HashSet<>();
        Optional<Element> resprocessing = XmlSupport.child(item, "resprocessing", QTI);
        if (resprocessing.isEmpty()) {
            return correct;
        }
        for (Element condition : XmlSupport.children(resprocessing.get(), "respcondition", QTI)) {
            boolean fullScore = XmlSupport.children(condition, "setvar", QTI).stream()
                    .map(Element::getTextTrim)
                    .anyMatch(QtiReader::isFullScore);
            if (!fullScore) {
                continue;
            }
            for (Element varequal : XmlSupport.descendants(condition, "varequal", QTI)) {
                if (!negated(varequal, condition) && !varequal.getTextTrim().isEmpty()) {
                    correct.add(varequal.getTextTrim());
                }
            }
        }
        return correct;
    }

    private static boolean isFullScore(String value) {
        try {
            return Double.parseDouble(value) >= 100;
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    private static boolean negated(Element element, Element stop) {
        for (Element parent = element.getParent(); parent != null && parent != stop; parent = parent.getParent()) {
            if ("not".equals(parent.getName())) {
                return true;
            }
        }
        return false;
    }

    private static Double points(Map<String, String> metadata) {
        String value = metadata.getOrDefault("cc_weighting", metadata.get("points_possible"));
        return value == null ? null : parseDouble(value);
    }

    private static Double parseDouble(String value) {
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static List<QuestionGroup> groups(Element assessment) {
        List<QuestionGroup> groups = new ArrayList<>();
        for (Element selection : XmlSupport.descendants(assessment, "selection", QTI)) {
            Optional<String> bank = XmlSupport.childText(selection, "sourcebank_ref", QTI);
            if (bank.isEmpty()) {
                continue;
            }
            int pick = XmlSupport.childText(selection, "selection_number", QTI).map(QtiReader::parseInt).orElse(1);
            Double perItem = XmlSupport.child(selection, "selection_extension", QTI)
                    .flatMap(e -> XmlSupport.childText(e, "points_per_item", QTI))
                    .map(QtiReader::parseDouble)
                    .orElse(null);
            groups.add(new QuestionGroup(bank.get(), Math.max(pick, 1), perItem));
        }
        return groups;
    }

    private static int parseInt(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            return 1;
        }
    }

    private String text(Element mattext) {
        String raw = mattext.getText();
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String type = mattext.attributeValue("texttype", "text/plain");
        return type.contains("html") ? htmlToMarkdown.convert(raw) : raw.strip();
    }
}
