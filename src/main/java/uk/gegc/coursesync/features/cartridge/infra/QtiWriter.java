package uk.gegc.coursesync.features.cartridge.infra;

import org.dom4j.Document;
import org.dom4j.DocumentHelper;
import org.dom4j.Element;
import org.dom4j.Namespace;
import org.dom4j.QName;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.course.domain.model.AnswerChoice;
import uk.gegc.coursesync.features.course.domain.model.Question;
import uk.gegc.coursesync.features.course.domain.model.QuestionBank;
import uk.gegc.coursesync.features.course.domain.model.QuestionGroup;
import uk.gegc.coursesync.features.course.domain.model.QuestionType;
import uk.gegc.coursesync.features.course.domain.model.Quiz;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.INLINE_QUESTIONS_FLAG;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.POINTS_POSSIBLE_FIELD;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.QTI;
import static uk.gegc.coursesync.features.cartridge.domain.CartridgeNamespaces.XSI;

/**
 * Writes QTI 1.2 documents. The same quiz is written twice: once with Common Cartridge item profiles
 * for the structured assessment file, once with platform question types for the flat index.
 */
@Component
public class QtiWriter {

    public enum Flavor {
        /**
         * {@code cc_profile} and {@code cc_weighting} item metadata.
         */
        CARTRIDGE,
        /**
         * {@code question_type} and {@code points_possible} item metadata.
         */
        PLATFORM
    }

    private static final String RESPONSE = "response1";

    /**
     * @param descriptionHtml rendered description, written to the objectives field when not blank
     * @param html            renders question text to HTML
     * @param bankIdentifier  maps a group's bank reference to the bank's archive identifier
     */
    public Document assessment(Quiz quiz, String descriptionHtml, UnaryOperator<String> html,
                               UnaryOperator<String> bankIdentifier, Flavor flavor) {
        Document document = DocumentHelper.createDocument();
        Element root = root(document);
        Element assessment = root.addElement("assessment", QTI)
                .addAttribute("ident", quiz.getId())
                .addAttribute("title", quiz.getTitle());

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("cc_maxattempts", quiz.getAllowedAttempts() == null ? "unlimited" : quiz.getAllowedAttempts().toString());
        if (quiz.getTimeLimit() != null) {
            metadata.put("qmd_timelimit", quiz.getTimeLimit().toString());
        }
        metadata.put(INLINE_QUESTIONS_FLAG, "true");
        if (quiz.getPointsPossible() != null) {
            metadata.put(POINTS_POSSIBLE_FIELD, quiz.getPointsPossible().toString());
        }
        addMetadata(assessment, metadata);

        if (descriptionHtml != null && !descriptionHtml.isBlank()) {
            Element material = assessment.addElement("objectives", QTI).addElement("material", QTI);
            material.addAttribute("label", "Summary");
            mattext(material, descriptionHtml, "text/html");
        }

        Element section = assessment.addElement("section", QTI).addAttribute("ident", "root_section");
        int number = 1;
        for (Question question : quiz.getQuestions()) {
            String id = question.id() != null ? question.id() : quiz.getId() + "_q" + number;
            Double points = question.points() != null ? question.points() : quiz.getPointsPerQuestion();
            writeItem(section, question, id, number++, points, html, flavor);
        }
        int groupNumber = 1;
        for (QuestionGroup group : quiz.getGroups()) {
            Element groupSection = section.addElement("section", QTI)
                    .addAttribute("ident", quiz.getId() + "_g" + groupNumber)
                    .addAttribute("title", "Group " + groupNumber++);
            Element selection = groupSection.addElement("selection_ordering", QTI).addElement("selection", QTI);
            XmlSupport.addText(selection, "sourcebank_ref", bankIdentifier.apply(group.bank()));
            XmlSupport.addText(selection, "selection_number", group.pick());
            Double perItem = group.pointsPerQuestion() != null ? group.pointsPerQuestion() : quiz.getPointsPerQuestion();
            XmlSupport.addText(selection.addElement("selection_extension", QTI), "points_per_item", perItem);
        }
        return document;
    }

    public Document objectBank(QuestionBank bank, UnaryOperator<String> html, Flavor flavor) {
        Document document = DocumentHelper.createDocument();
        Element bankElement = root(document).addElement("objectbank", QTI).addAttribute("ident", bank.id());
        addMetadata(bankElement, Map.of("bank_title", bank.title()));
        int number = 1;
        for (Question question : bank.questions()) {
            String id = question.id() != null ? question.id() : bank.id() + "_q" + number;
            writeItem(bankElement, question, id, number++, question.points() != null ? question.points() : 1.0, html, flavor);
        }
        return document;
    }

    private static Element root(Document document) {
        Element root = document.addElement("questestinterop", QTI);
        root.addNamespace("xsi", XSI);
        root.addAttribute(QName.get("schemaLocation", Namespace.get("xsi", XSI)),
                QTI + " http://www.imsglobal.org/profile/cc/ccv1p1/ccv1p1_qtiasiv1p2p1_v1p0.xsd");
        return root;
    }

    private void writeItem(Element parent, Question question, String id, int number, Double points,
                           UnaryOperator<String> html, Flavor flavor) {
        Element item = parent.addElement("item", QTI)
                .addAttribute("ident", id)
                .addAttribute("title", "Question " + number);

        Map<String, String> metadata = new LinkedHashMap<>();
        if (flavor == Flavor.CARTRIDGE) {
            metadata.put("cc_profile", question.type().ccProfile());
            metadata.put("cc_weighting", String.valueOf(points));
        } else {
            metadata.put("question_type", question.type().remoteName());
            metadata.put("points_possible", String.valueOf(points));
        }
        addMetadata(item.addElement("itemmetadata", QTI), metadata);

        Element presentation = item.addElement("presentation", QTI);
        mattext(presentation.addElement("material", QTI), html.apply(question.text()), "text/html");

        switch (question.type()) {
            case MULTIPLE_CHOICE, TRUE_FALSE, MULTIPLE_ANSWERS -> writeChoices(item, presentation, question, id);
            case SHORT_ANSWER -> writeShortAnswer(item, presentation, question);
            case ESSAY -> presentation.addElement("response_str", QTI)
                    .addAttribute("ident", RESPONSE)
                    .addAttribute("rcardinality", "Single")
                    .addElement("render_fib", QTI)
                    .addAttribute("rows", "15");
            case FILE_UPLOAD -> {
                // prompt only
            }
        }
    }

    private void writeChoices(Element item, Element presentation, Question question, String id) {
        boolean multiple = question.type() == QuestionType.MULTIPLE_ANSWERS;
        Element choices = presentation.addElement("response_lid", QTI)
                .addAttribute("ident", RESPONSE)
                .addAttribute("rcardinality", multiple ? "Multiple" : "Single")
                .addElement("render_choice", QTI);
        List<AnswerChoice> answers = question.answers();
        for (int i = 0; i < answers.size(); i++) {
            Element label = choices.addElement("response_label", QTI).addAttribute("ident", answerId(id, i));
            mattext(label.addElement("material", QTI), answers.get(i).text(), "text/plain");
        }

        Element conditionVar = scoring(item);
        if (multiple) {
            Element and = conditionVar.addElement("and", QTI);
            for (int i = 0; i < answers.size(); i++) {
                Element target = answers.get(i).correct() ? and : and.addElement("not", QTI);
                varequal(target, answerId(id, i));
            }
            return;
        }
        for (int i = 0; i < answers.size(); i++) {
            if (answers.get(i).correct()) {
                varequal(conditionVar, answerId(id, i));
                break;
            }
        }
    }

    private void writeShortAnswer(Element item, Element presentation, Question question) {
        presentation.addElement("response_str", QTI)
                .addAttribute("ident", RESPONSE)
                .addAttribute("rcardinality", "Single")
                .addElement("render_fib", QTI)
                .addElement("response_label", QTI)
                .addAttribute("ident", "answer1")
                .addAttribute("rshuffle", "No");
        Element conditionVar = scoring(item);
        question.answers().forEach(a -> varequal(conditionVar, a.text()));
    }

    /**
     * Adds the full-score response condition and returns its condition container.
     */
    private static Element scoring(Element item) {
        Element resprocessing = item.addElement("resprocessing", QTI);
        resprocessing.addElement("outcomes", QTI).addElement("decvar", QTI)
                .addAttribute("maxvalue", "100")
                .addAttribute("minvalue", "0")
                .addAttribute("varname", "SCORE")
                .addAttribute("vartype", "Decimal");
        Element condition = resprocessing.addElement("respcondition", QTI).addAttribute("continue", "No");
        Element conditionVar = condition.addElement("conditionvar", QTI);
        condition.addElement("setvar", QTI)
                .addAttribute("action", "Set")
                .addAttribute("varname", "SCORE")
                .setText("100");
        return conditionVar;
    }

    private static void varequal(Element parent, String value) {
        parent.addElement("varequal", QTI).addAttribute("respident", RESPONSE).setText(value);
    }

    private static String answerId(String questionId, int index) {
        return questionId + "_a" + (index + 1);
    }

    private static void mattext(Element material, String text, String textType) {
        material.addElement("mattext", QTI).addAttribute("texttype", textType).setText(text == null ? "" : text);
    }

    private static void addMetadata(Element parent, Map<String, String> fields) {
        Element metadata = parent.addElement("qtimetadata", QTI);
        fields.forEach((label, entry) -> {
            Element field = metadata.addElement("qtimetadatafield", QTI);
            XmlSupport.addText(field, "fieldlabel", label);
            XmlSupport.addText(field, "fieldentry", entry);
        });
    }
}
