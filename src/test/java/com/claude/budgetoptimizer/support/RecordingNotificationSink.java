package com.claude.budgetoptimizer.support;

import com.claude.budgetoptimizer.domain.NotificationRequest;
import com.claude.budgetoptimizer.service.NotificationSink;

import java.util.ArrayList;
import java.util.List;

public class RecordingNotificationSink implements NotificationSink {

    public final List<NotificationRequest> requests = new ArrayList<>();
    public boolean failing;

    @Override
    public boolean notify(NotificationRequest request) {
        if (failing) {
            throw new IllegalStateException("notification store unavailable");
        }
        requests.add(request);
        return true;
    }
}
