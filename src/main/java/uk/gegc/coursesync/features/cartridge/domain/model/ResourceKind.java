package uk.gegc.coursesync.features.cartridge.domain.model;

public enum ResourceKind {
    COURSE_SETTINGS,
    PAGE,
    ASSIGNMENT,
    ASSESSMENT,
    ASSESSMENT_META,
    LINK,
    ASSET,
    UNKNOWN
}
