package com.costtelemetry.notification;

import com.costtelemetry.domain.model.AlertSeverity;

/**
 * Outbound channel for budget alert transitions.
 *
 * Fire-and-forget: callers log and swallow delivery failures, the alert
 * transition is never rolled back because of a failed notification.
 */
public interface BudgetAlertNotifier {

    void notify(String alertName, double percentageUsed, AlertSeverity severity);
}
