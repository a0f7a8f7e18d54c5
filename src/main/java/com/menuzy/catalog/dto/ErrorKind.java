package com.menuzy.catalog.dto;

/**
 * Why a load failed. Every kind is recoverable by the caller.
 */
public enum ErrorKind {

    /** The input is wrong: a field or reference problem. Fix the batch and retry. */
    VALIDATION,

    /** The store refused the batch: a uniqueness conflict with stored rows or a concurrent load. Retry after re-validating. */
    STORE,

    /** The transaction ran past its deadline and was rolled back. Retry. */
    TIMEOUT
}
