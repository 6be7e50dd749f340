package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.NotificationRequest;

public interface NotificationSink {

    /**
     * @return 저장했으면 true, 같은 날 같은 알림이 이미 있어서 버렸으면 false
     */
    boolean notify(NotificationRequest request);
}
