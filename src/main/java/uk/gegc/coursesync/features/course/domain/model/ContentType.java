package uk.gegc.coursesync.features.course.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Variant of a content item. The author tree encodes it only in the folder suffix, the remote
 * platform in a module item content type.
 */
public enum ContentType {
    PAGE("page", "WikiPage", "Page"),
    ASSIGNMENT("assignment", "Assignment", "Assignment"),
    QUIZ("quiz", "Quizzes::Quiz", "Quiz"),
    LINK("link", "ExternalUrl", "ExternalUrl"),
    FILE("file", "Attachment", "File");

    private final String folderSuffix;
    private final String packageContentType;
    private final String remoteModuleItemType;

    ContentType(String folderSuffix, String packageContentType, String remoteModuleItemType) {
        this.folderSuffix = folderSuffix;
        this.packageContentType = packageContentType;
        this.remoteModuleItemType = remoteModuleItemType;
    }

    public String folderSuffix() {
        return folderSuffix;
    }

    public String packageContentType() {
        return packageContentType;
    }

    public String remoteModuleItemType() {
        return remoteModuleItemType;
    }

    public static Optional<ContentType> fromFolderName(String folderName) {
        if (folderName == null) {
            return Optional.empty();
        }
        int dot = folderName.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String suffix = folderName.substring(dot + 1);
        return Arrays.stream(values()).filter(t -> t.folderSuffix.equals(suffix)).findFirst();
    }

    public static Optional<ContentType> fromPackageContentType(String value) {
        return Arrays.stream(values()).filter(t -> t.packageContentType.equals(value)).findFirst();
    }
}
