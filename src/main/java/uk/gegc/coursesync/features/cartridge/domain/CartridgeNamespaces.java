package uk.gegc.coursesync.features.cartridge.domain;

import java.util.List;

/**
 * Namespaces and fixed names of the cartridge layout. Lookups accept every listed version of a
 * namespace before falling back to unqualified names.
 */
public final class CartridgeNamespaces {

    public static final String IMSCC_1_1 = "http://www.imsglobal.org/xsd/imsccv1p1/imscp_v1p1";
    public static final String IMSCC_1_2 = "http://www.imsglobal.org/xsd/imsccv1p2/imscp_v1p1";
    public static final String IMSCC_1_3 = "http://www.imsglobal.org/xsd/imsccv1p3/imscp_v1p1";
    public static final String LOM_MANIFEST = "http://ltsc.ieee.org/xsd/imsccv1p1/LOM/manifest";
    public static final String LOM_RESOURCE = "http://ltsc.ieee.org/xsd/imsccv1p1/LOM/resource";
    public static final String QTI = "http://www.imsglobal.org/xsd/ims_qtiasiv1p2";
    public static final String CANVAS = "http://canvas.instructure.com/xsd/cccv1p0";
    public static final String WEBLINK_1_1 = "http://www.imsglobal.org/xsd/imsccv1p1/imswl_v1p1";
    public static final String WEBLINK_1_3 = "http://www.imsglobal.org/xsd/imsccv1p3/imswl_v1p3";
    public static final String XSI = "http://www.w3.org/2001/XMLSchema-instance";

    public static final List<String> MANIFEST = List.of(IMSCC_1_1, IMSCC_1_2, IMSCC_1_3);
    public static final List<String> WEBLINK = List.of(WEBLINK_1_1, WEBLINK_1_3);

    public static final String MANIFEST_FILE = "imsmanifest.xml";
    public static final String EXPORT_SENTINEL = "course_settings/canvas_export.txt";
    public static final String COURSE_SETTINGS = "course_settings/course_settings.xml";
    public static final String MODULE_META = "course_settings/module_meta.xml";
    public static final String ASSIGNMENT_GROUPS = "course_settings/assignment_groups.xml";
    public static final String RUBRICS = "course_settings/rubrics.xml";
    public static final String FILES_META = "course_settings/files_meta.xml";
    public static final String WIKI_DIR = "wiki_content";
    public static final String WEB_RESOURCES_DIR = "web_resources";
    public static final String FLAT_INDEX_DIR = "non_cc_assessments";
    public static final String FLAT_INDEX_SUFFIX = ".xml.qti";
    public static final String ASSESSMENT_FILE = "assessment_qti.xml";
    public static final String ASSESSMENT_META_FILE = "assessment_meta.xml";
    public static final String ASSIGNMENT_SETTINGS_FILE = "assignment_settings.xml";
    public static final String FILEBASE_TOKEN = "$IMS-CC-FILEBASE$";

    public static final String TYPE_WEBCONTENT = "webcontent";
    public static final String TYPE_LEARNING_APPLICATION = "associatedcontent/imscc_xmlv1p1/learning-application-resource";
    public static final String TYPE_ASSESSMENT = "imsqti_xmlv1p2/imscc_xmlv1p1/assessment";
    public static final String TYPE_QUESTION_BANK = "imsqti_xmlv1p2/imscc_xmlv1p1/question-bank";
    public static final String TYPE_WEBLINK = "imswl_xmlv1p1";

    /**
     * QTI metadata field marking a quiz whose questions are inline content, written on export.
     */
    public static final String INLINE_QUESTIONS_FLAG = "coursesync_inline_questions";
    public static final String POINTS_POSSIBLE_FIELD = "coursesync_points_possible";

    private CartridgeNamespaces() {
    }

    public static String flatIndexPath(String identifier) {
        return FLAT_INDEX_DIR + "/" + identifier + FLAT_INDEX_SUFFIX;
    }
}
