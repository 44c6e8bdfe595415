package com.tradegate.backend.broker;

import com.tradegate.backend.model.ErrorCategory;

public enum BrokerFailure {
    NOT_CONNECTED(ErrorCategory.CONNECTION),
    UNAVAILABLE(ErrorCategory.CONNECTION),
    TIMEOUT(ErrorCategory.EXECUTION),
    REJECTED(ErrorCategory.EXECUTION),
    NO_DATA(ErrorCategory.DATA);

    private final ErrorCategory category;

    BrokerFailure(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
