package com.ttennebkram.imageeditor.session;

/**
 * Last transition an {@link EditSession} went through.
 */
public enum EditSessionState {
    /** Nothing loaded yet. */
    EMPTY,
    /** Freshly loaded or reset to the original; clean. */
    LOADED,
    /** A filter was applied; dirty. */
    EDITED,
    UNDONE,
    REDONE,
    /** Current buffer was written out; clean. */
    SAVED
}
