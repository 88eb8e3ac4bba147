package com.example.newsharvester.model;

public enum StopReason {
    END_OF_PAGINATION,
    TRANSIENT_ERROR,
    PAGE_LIMIT,
    INTERRUPTED
}
