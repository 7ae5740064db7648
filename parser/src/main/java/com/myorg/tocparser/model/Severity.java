package com.myorg.tocparser.model;

public enum Severity {
    /** Output was produced, possibly adjusted. */
    WARNING,
    /** The entry was left out of the output. */
    ERROR
}
