package uk.gegc.coursesync.features.cartridge.domain.model;

public enum QuizPlacement {
    INLINE,
    BANK
}
