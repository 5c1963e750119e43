package com.mapsheet.collection.resolve;

/**
 * Why a file was not accepted as a submission, in reporting precedence order:
 * when several apply, the earliest constant is reported.
 */
public enum RejectionReason {
    NO_IDENTIFIER_MATCH,
    NO_CATEGORY_MATCH,
    /**
     * No real calendar date anywhere in the file name.
     */
    NO_DATE_MATCH,
    DATE_OUT_OF_RANGE,
    UNSUPPORTED_EXTENSION
}
