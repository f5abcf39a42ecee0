package com.anchorinsights.common.exception;

/**
 * Error taxonomy surfaced to API callers. The web layer maps each kind to an HTTP status.
 */
public enum ErrorKind {
    NOT_FOUND,
    BAD_REQUEST,
    INTERNAL_ERROR
}
