package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.AuditEntry;

public interface AuditTrail {

    void record(AuditEntry entry);
}
