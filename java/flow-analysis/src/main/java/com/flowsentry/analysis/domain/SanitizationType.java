package com.flowsentry.analysis.domain;

public enum SanitizationType {
    VALIDATION,
    ENCODING,
    ESCAPING,
    WHITELIST,
    CONVERSION,
    LENGTH_LIMIT
}
