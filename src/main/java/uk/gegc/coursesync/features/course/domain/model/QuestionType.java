package uk.gegc.coursesync.features.course.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Supported question kinds with their remote and Common Cartridge profile names.
 */
public enum QuestionType {
    MULTIPLE_CHOICE("multiple_choice_question", "cc.multiple_choice.v0p1"),
    TRUE_FALSE("true_false_question", "cc.true_false.v0p1"),
    MULTIPLE_ANSWERS("multiple_answers_question", "cc.multiple_response.v0p1"),
    SHORT_ANSWER("short_answer_question", "cc.fib.v0p1"),
    ESSAY("essay_question", "cc.essay.v0p1"),
    FILE_UPLOAD("file_upload_question", "cc.file_upload.v0p1");

    private final String remoteName;
    private final String ccProfile;

    QuestionType(String remoteName, String ccProfile) {
        this.remoteName = remoteName;
        this.ccProfile = ccProfile;
    }

    public String remoteName() {
        return remoteName;
    }

    public String ccProfile() {
        return ccProfile;
    }

    public boolean hasChoices() {
        return this == MULTIPLE_CHOICE || this == TRUE_FALSE || this == MULTIPLE_ANSWERS;
    }

    public static Optional<QuestionType> fromRemoteName(String name) {
        return Arrays.stream(values()).filter(t -> t.remoteName.equals(name)).findFirst();
    }

    public static Optional<QuestionType> fromCcProfile(String profile) {
        return Arrays.stream(values()).filter(t -> t.ccProfile.equals(profile)).findFirst();
    }
}
