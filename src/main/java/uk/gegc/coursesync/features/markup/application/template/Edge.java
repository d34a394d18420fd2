package uk.gegc.coursesync.features.markup.application.template;

/**
 * Which end of the content a template fragment was attached to.
 */
public enum Edge {
    START,
    END
}
