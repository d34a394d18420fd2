package uk.gegc.coursesync.features.source.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.coursesync.BaseUnitTest;
import uk.gegc.coursesync.features.course.domain.model.AnswerChoice;
import uk.gegc.coursesync.features.course.domain.model.Question;
import uk.gegc.coursesync.features.course.domain.model.QuestionType;
import uk.gegc.coursesync.features.source.domain.model.QuizText;
import uk.gegc.coursesync.shared.exception.ValidationException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QuizTextCodec Tests")
class QuizTextCodecTest extends BaseUnitTest {

    private final QuizTextCodec codec = new QuizTextCodec();

    @Test
    @DisplayName("parse: description kept apart from the questions")
    void parse_descriptionAndQuestion_split() {
        // When
        QuizText text = codec.parse("Read ch.1\n\n1. Capital of France?\n*a) Paris\nb) Lyon\n", "quiz");

        // Then
        assertThat(text.description()).isEqualTo("Read ch.1");
        assertThat(text.questions()).singleElement().satisfies(q -> {
            assertThat(q.type()).isEqualTo(QuestionType.MULTIPLE_CHOICE);
            assertThat(q.text()).isEqualTo("Capital of France?");
            assertThat(q.answers()).containsExactly(new AnswerChoice("Paris", true), new AnswerChoice("Lyon", false));
        });
    }

    @Test
    @DisplayName("parse: every answer style recognised")
    void parse_allAnswerStyles_typed() {
        // Given
        String body = String.join("\n",
                "1. Is water wet?",
                "*a) True",
                "b) False",
                "",
                "2. Pick primes",
                "[*] 2",
                "[ ] 4",
                "[x] 3",
                "",
                "3. Spell 4",
                "* four",
                "* Four",
                "",
                "4. Discuss.",
                "####",
                "",
                "5. Upload your work.",
                "^^^^");

        // When
        List<Question> questions = codec.parse(body, "quiz").questions();

        // Then
        assertThat(questions).extracting(Question::type).containsExactly(
                QuestionType.TRUE_FALSE, QuestionType.MULTIPLE_ANSWERS, QuestionType.SHORT_ANSWER,
                QuestionType.ESSAY, QuestionType.FILE_UPLOAD);
        assertThat(questions.get(1).correctAnswers()).extracting(AnswerChoice::text).containsExactly("2", "3");
        assertThat(questions.get(2).answers()).hasSize(2);
        assertThat(questions.get(3).answers()).isEmpty();
    }

    @Test
    @DisplayName("parse: question text spans several lines")
    void parse_multilineQuestion_joined() {
        QuizText text = codec.parse("1. Look at this:\n\n![chart](chart.png)\n\nWhat trend?\n####", "quiz");

        assertThat(text.questions().get(0).text()).isEqualTo("Look at this:\n\n![chart](chart.png)\n\nWhat trend?");
        assertThat(text.description()).isEmpty();
    }

    @Test
    @DisplayName("parse: body without numbered lines is all description")
    void parse_noQuestions_descriptionOnly() {
        QuizText text = codec.parse("Draws from the bank.", "quiz");

        assertThat(text.questions()).isEmpty();
        assertThat(text.description()).isEqualTo("Draws from the bank.");
    }

    @Test
    @DisplayName("parse: choice question without a correct answer fails")
    void parse_noCorrectChoice_throws() {
        assertThatThrownBy(() -> codec.parse("1. Q?\na) x\nb) y", "content/q.quiz"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("no correct choice");
    }

    @Test
    @DisplayName("parse: mixed answer styles fail")
    void parse_mixedStyles_throws() {
        assertThatThrownBy(() -> codec.parse("1. Q?\n*a) x\n[ ] y", "content/q.quiz"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("mixes answer styles");
    }

    @Test
    @DisplayName("parse: question without answers fails")
    void parse_noAnswers_throws() {
        assertThatThrownBy(() -> codec.parse("1. Lonely question", "content/q.quiz"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("has no answers");
    }

    @Test
    @DisplayName("format: output parses back to the same questions")
    void format_questions_parsesBack() {
        // Given
        List<Question> questions = List.of(
                new Question(QuestionType.MULTIPLE_CHOICE, "Capital of France?",
                        List.of(new AnswerChoice("Paris", true), new AnswerChoice("Lyon", false))),
                new Question(QuestionType.ESSAY, "Why?", List.of()));

        // When
        String text = codec.format("Read ch.1", questions);
        QuizText parsed = codec.parse(text, "quiz");

        // Then
        assertThat(text).isEqualTo("Read ch.1\n\n1. Capital of France?\n*a) Paris\nb) Lyon\n\n2. Why?\n####\n");
        assertThat(parsed.questions()).isEqualTo(questions);
        assertThat(QuizTextCodec.extractDescription(text)).isEqualTo("Read ch.1");
    }
}
