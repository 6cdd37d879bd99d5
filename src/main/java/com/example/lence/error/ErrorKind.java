package com.example.lence.error;

public enum ErrorKind {
    NOT_FOUND,
    INVALID_PARAMETERS,
    CONFIGURATION_ERROR,
    QUERY_EXECUTION_FAILED
}
