package com.myorg.tocparser.model;

public enum LineKind {
    /** Chapter marker, possibly merged with the title line that follows it. */
    CHAPTER,
    /** Dash-numbered section or clause. */
    ITEM,
    /** Un-numbered entry such as an appendix or reference list. */
    OTHER
}
