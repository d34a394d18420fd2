package uk.gegc.coursesync.features.source.application;

import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.course.domain.model.AnswerChoice;
import uk.gegc.coursesync.features.course.domain.model.Question;
import uk.gegc.coursesync.features.course.domain.model.QuestionType;
import uk.gegc.coursesync.features.source.domain.model.QuizText;
import uk.gegc.coursesync.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plain-text question format shared by quizzes and banks.
 * <pre>
 * Description before the first numbered line.
 *
 * 1. Capital of France?
 * *a) Paris
 * b) Lyon
 *
 * 2. Pick primes
 * [*] 2
 * [ ] 4
 *
 * 3. Spell the number 4
 * * four
 *
 * 4. Discuss.
 * ####
 *
 * 5. Upload your work.
 * ^^^^
 * </pre>
 * A choice question whose two choices are True and False is a true/false question.
 */
@Component
public class QuizTextCodec {

    private static final Pattern QUESTION_START = Pattern.compile("^\\s*(\\d+)[.)]\\s+(.*)$");
    private static final Pattern CHOICE = Pattern.compile("^\\s*(\\*)?([a-zA-Z])\\)\\s+(.*)$");
    private static final Pattern CHECKBOX = Pattern.compile("^\\s*\\[([*xX ])]\\s+(.*)$");
    private static final Pattern SHORT_ANSWER = Pattern.compile("^\\s*\\*\\s+(.*)$");
    private static final Pattern ESSAY = Pattern.compile("^\\s*#{4,}\\s*$");
    private static final Pattern FILE_UPLOAD = Pattern.compile("^\\s*\\^{4,}\\s*$");
    private static final Pattern COMMENT = Pattern.compile("^\\s*<!--.*-->\\s*$");

    /**
     * Index of the first line that starts a numbered question, or -1.
     */
    public static int firstQuestionLine(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            if (QUESTION_START.matcher(lines.get(i)).matches()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * All text before the first numbered question line.
     */
    public static String extractDescription(String body) {
        List<String> lines = lines(body);
        int first = firstQuestionLine(lines);
        List<String> head = first < 0 ? lines : lines.subList(0, first);
        return String.join("\n", head).strip();
    }

    public QuizText parse(String body, String location) {
        List<String> lines = lines(body);
        int first = firstQuestionLine(lines);
        if (first < 0) {
            return new QuizText(String.join("\n", lines), List.of());
        }
        String description = String.join("\n", lines.subList(0, first));

        List<Question> questions = new ArrayList<>();
        Draft draft = null;
        for (int i = first; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher start = QUESTION_START.matcher(line);
            if (start.matches()) {
                if (draft != null) {
                    questions.add(draft.build(location));
                }
                draft = new Draft(start.group(1), start.group(2));
                continue;
            }
            if (line.isBlank() || COMMENT.matcher(line).matches()) {
                draft.blank();
                continue;
            }
            draft.accept(line, location);
        }
        if (draft != null) {
            questions.add(draft.build(location));
        }
        return new QuizText(description, questions);
    }

    public String format(String description, List<Question> questions) {
        StringBuilder out = new StringBuilder();
        if (description != null && !description.isBlank()) {
            out.append(description.strip()).append("\n\n");
        }
        int number = 1;
        for (Question question : questions) {
            out.append(number++).append(". ").append(question.text()).append('\n');
            switch (question.type()) {
                case MULTIPLE_CHOICE, TRUE_FALSE -> {
                    char letter = 'a';
                    for (AnswerChoice answer : question.answers()) {
                        out.append(answer.correct() ? "*" : "").append(letter++).append(") ")
                                .append(answer.text()).append('\n');
                    }
                }
                case MULTIPLE_ANSWERS -> question.answers().forEach(a ->
                        out.append(a.correct() ? "[*] " : "[ ] ").append(a.text()).append('\n'));
                case SHORT_ANSWER -> question.answers().forEach(a -> out.append("* ").append(a.text()).append('\n'));
                case ESSAY -> out.append("####\n");
                case FILE_UPLOAD -> out.append("^^^^\n");
            }
            out.append('\n');
        }
        return out.toString().strip() + "\n";
    }

    private static List<String> lines(String body) {
        if (body == null || body.isEmpty()) {
            return List.of();
        }
        return List.of(body.replace("\r\n", "\n").split("\n", -1));
    }

    private static final class Draft {
        private final String number;
        private final StringBuilder text;
        private final List<AnswerChoice> answers = new ArrayList<>();
        private QuestionType type;
        private boolean blankSeen;

        Draft(String number, String firstLine) {
            this.number = number;
            this.text = new StringBuilder(firstLine.strip());
        }

        void blank() {
            blankSeen = true;
        }

        void accept(String line, String location) {
            Matcher choice = CHOICE.matcher(line);
            Matcher checkbox = CHECKBOX.matcher(line);
            Matcher shortAnswer = SHORT_ANSWER.matcher(line);
            if (choice.matches()) {
                setType(QuestionType.MULTIPLE_CHOICE, location);
                answers.add(new AnswerChoice(choice.group(3), choice.group(1) != null));
            } else if (checkbox.matches()) {
                setType(QuestionType.MULTIPLE_ANSWERS, location);
                answers.add(new AnswerChoice(checkbox.group(2), !" ".equals(checkbox.group(1))));
            } else if (ESSAY.matcher(line).matches()) {
                setType(QuestionType.ESSAY, location);
            } else if (FILE_UPLOAD.matcher(line).matches()) {
                setType(QuestionType.FILE_UPLOAD, location);
            } else if (shortAnswer.matches()) {
                setType(QuestionType.SHORT_ANSWER, location);
                answers.add(new AnswerChoice(shortAnswer.group(1), true));
            } else if (type == null) {
                text.append(blankSeen ? "\n\n" : "\n").append(line.strip());
                blankSeen = false;
            } else {
                throw new ValidationException(location, "question " + number + ": unexpected line '" + line.strip() + "'");
            }
        }

        private void setType(QuestionType candidate, String location) {
            if (type != null && type != candidate) {
                throw new ValidationException(location, "question " + number + " mixes answer styles");
            }
            type = candidate;
        }

        Question build(String location) {
            if (type == null) {
                throw new ValidationException(location, "question " + number + " has no answers");
            }
            QuestionType finalType = type;
            if (type == QuestionType.MULTIPLE_CHOICE) {
                if (answers.stream().noneMatch(AnswerChoice::correct)) {
                    throw new ValidationException(location, "question " + number + " has no correct choice");
                }
                if (isTrueFalse()) {
                    finalType = QuestionType.TRUE_FALSE;
                }
            }
            return new Question(null, finalType, text.toString(), answers, null);
        }

        private boolean isTrueFalse() {
            return answers.size() == 2
                    && "true".equalsIgnoreCase(answers.get(0).text())
                    && "false".equalsIgnoreCase(answers.get(1).text());
        }
    }
}
