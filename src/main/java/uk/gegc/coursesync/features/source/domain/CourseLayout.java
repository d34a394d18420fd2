package uk.gegc.coursesync.features.source.domain;

import uk.gegc.coursesync.features.course.domain.ItemOrdering;

import java.nio.file.Path;

/**
 * Fixed locations inside an author course tree.
 */
public record CourseLayout(Path root) {

    public static final String COURSE_FILE = "course.yaml";
    public static final String CONTENT_DIR = "content";
    public static final String MODULE_SUFFIX = ".module";
    public static final String INDEX_FILE = "index.md";
    public static final String RUBRIC_FILE = "rubric.yaml";
    public static final String MODULE_ORDER_FILE = "modules/module_order.yaml";
    public static final String BANKS_DIR = "question-banks";
    public static final String BANK_SUFFIX = ".bank.md";
    public static final String RUBRICS_DIR = "rubrics";
    public static final String RUBRIC_ROWS_DIR = "rubrics/rows";
    public static final String ASSETS_DIR = "assets";

    public CourseLayout {
        root = root.toAbsolutePath().normalize();
    }

    public Path courseFile() {
        return root.resolve(COURSE_FILE);
    }

    public Path contentDir() {
        return root.resolve(CONTENT_DIR);
    }

    public Path moduleOrderFile() {
        return root.resolve(MODULE_ORDER_FILE);
    }

    public Path banksDir() {
        return root.resolve(BANKS_DIR);
    }

    public Path rubricsDir() {
        return root.resolve(RUBRICS_DIR);
    }

    public Path rubricRowsDir() {
        return root.resolve(RUBRIC_ROWS_DIR);
    }

    public Path assetsDir() {
        return root.resolve(ASSETS_DIR);
    }

    public static boolean isModuleFolder(String name) {
        return name.endsWith(MODULE_SUFFIX);
    }

    public static String moduleFolderTitle(String folderName) {
        String base = folderName.substring(0, folderName.length() - MODULE_SUFFIX.length());
        return ItemOrdering.stripNumericPrefix(base);
    }
}
