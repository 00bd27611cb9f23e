package com.costtelemetry.notification;

import com.costtelemetry.domain.model.AlertSeverity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default notifier: writes one structured log line per triggered alert.
 * Email, chat and webhook transports plug in as other implementations.
 */
@Component
@Slf4j
public class LoggingBudgetAlertNotifier implements BudgetAlertNotifier {

    @Override
    public void notify(String alertName, double percentageUsed, AlertSeverity severity) {
        log.warn("BUDGET ALERT [{}] {}: {}% of budget used",
                severity, alertName, String.format("%.1f", percentageUsed));
    }
}
