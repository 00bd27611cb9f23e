package com.costtelemetry.api;

import com.costtelemetry.domain.model.*;
import com.costtelemetry.service.BudgetService;
import com.costtelemetry.service.BudgetService.AddAlertRequest;
import com.costtelemetry.service.BudgetService.BudgetSummary;
import com.costtelemetry.service.BudgetService.CreateBudgetRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Budget and budget alert administration.
 *
 * Alerts are returned as {@link AlertResponse} views so the lazily loaded
 * budget association never reaches the serializer.
 */
@RestController
@RequestMapping("/api/v1/cost-telemetry/budgets")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Budgets", description = "Budget creation, status and alert management")
public class BudgetController {

    private final BudgetService budgetService;

    @PostMapping
    @Operation(summary = "Create a budget",
               description = "End date defaults to start plus one period; a default threshold alert can be attached")
    public ResponseEntity<Budget> createBudget(@Valid @RequestBody CreateBudgetBody body) {
        log.info("Create budget request: name={}, period={}, scope={}", body.name(), body.period(), body.scope());
        var budget = budgetService.createBudget(new CreateBudgetRequest(
                body.name(),
                body.description(),
                body.period(),
                body.amount(),
                body.currency(),
                body.scope(),
                body.scopeId(),
                body.resourceFilters(),
                body.startDate(),
                body.endDate(),
                Boolean.TRUE.equals(body.autoReset()),
                Boolean.TRUE.equals(body.rolloverUnused()),
                body.createdBy(),
                !Boolean.FALSE.equals(body.attachDefaultAlert()),
                body.alertThresholdPercentage()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(budget);
    }

    @GetMapping
    @Operation(summary = "List budgets with current spend")
    public ResponseEntity<List<BudgetResponse>> getBudgets(
            @RequestParam(required = false) BudgetStatus status,
            @RequestParam(required = false) BudgetScope scope,
            @RequestParam(required = false) String scopeId
    ) {
        return ResponseEntity.ok(budgetService.listBudgets(status, scope, scopeId).stream()
                .map(BudgetResponse::from)
                .toList());
    }

    @GetMapping("/{budgetId}")
    @Operation(summary = "Get a budget with current spend")
    public ResponseEntity<BudgetResponse> getBudget(@PathVariable Long budgetId) {
        return ResponseEntity.of(budgetService.findBudget(budgetId).map(BudgetResponse::from));
    }

    @PatchMapping("/{budgetId}/status")
    @Operation(summary = "Activate, pause or delete a budget")
    public ResponseEntity<Budget> updateBudgetStatus(
            @PathVariable Long budgetId,
            @Valid @RequestBody BudgetStatusRequest request
    ) {
        return ResponseEntity.of(budgetService.updateStatus(budgetId, request.status()));
    }

    @PostMapping("/{budgetId}/alerts")
    @Operation(summary = "Attach an alert to a budget")
    public ResponseEntity<AlertResponse> addAlert(
            @PathVariable Long budgetId,
            @Valid @RequestBody AddAlertBody body
    ) {
        var alert = budgetService.addAlert(budgetId, new AddAlertRequest(
                body.name(),
                body.alertType(),
                body.thresholdPercentage(),
                body.forecastDays(),
                body.severity(),
                body.notificationChannels()
        ));
        return alert
                .map(a -> ResponseEntity.status(HttpStatus.CREATED).body(AlertResponse.from(a)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/alerts/{alertId}/snooze")
    @Operation(summary = "Snooze an alert until a deadline")
    public ResponseEntity<AlertResponse> snoozeAlert(
            @PathVariable Long alertId,
            @Valid @RequestBody SnoozeRequest request
    ) {
        return ResponseEntity.of(budgetService.snoozeAlert(alertId, request.until()).map(AlertResponse::from));
    }

    @PostMapping("/alerts/{alertId}/unsnooze")
    @Operation(summary = "Return a snoozed alert to evaluation")
    public ResponseEntity<AlertResponse> unsnoozeAlert(@PathVariable Long alertId) {
        return ResponseEntity.of(budgetService.unsnoozeAlert(alertId).map(AlertResponse::from));
    }

    // Request/Response DTOs

    public record CreateBudgetBody(
            @NotBlank String name,
            String description,
            @NotNull CostPeriod period,
            @NotNull @DecimalMin(value = "0.0", inclusive = false) BigDecimal amount,
            String currency,
            BudgetScope scope,
            String scopeId,
            Map<String, String> resourceFilters,
            LocalDateTime startDate,
            LocalDateTime endDate,
            Boolean autoReset,
            Boolean rolloverUnused,
            String createdBy,
            Boolean attachDefaultAlert,
            @Positive Double alertThresholdPercentage
    ) {}

    public record AddAlertBody(
            @NotBlank String name,
            @NotNull AlertType alertType,
            @Positive double thresholdPercentage,
            Integer forecastDays,
            AlertSeverity severity,
            List<String> notificationChannels
    ) {}

    public record BudgetStatusRequest(@NotNull BudgetStatus status) {}

    public record SnoozeRequest(@NotNull LocalDateTime until) {}

    public record AlertResponse(
            Long id,
            String name,
            AlertType alertType,
            double thresholdPercentage,
            Integer forecastDays,
            double currentAmount,
            double percentageUsed,
            Double projectedAmount,
            AlertStatus status,
            AlertSeverity severity,
            List<String> notificationChannels,
            LocalDateTime lastTriggered,
            LocalDateTime snoozeUntil,
            int triggerCount
    ) {
        static AlertResponse from(BudgetAlert alert) {
            return new AlertResponse(
                    alert.getId(),
                    alert.getName(),
                    alert.getAlertType(),
                    alert.getThresholdPercentage(),
                    alert.getForecastDays(),
                    alert.getCurrentAmount(),
                    alert.getPercentageUsed(),
                    alert.getProjectedAmount(),
                    alert.getStatus(),
                    alert.getSeverity(),
                    alert.getNotificationChannels(),
                    alert.getLastTriggered(),
                    alert.getSnoozeUntil(),
                    alert.getTriggerCount()
            );
        }
    }

    public record BudgetResponse(
            Budget budget,
            double currentSpend,
            Double utilizationPercentage,
            List<AlertResponse> alerts
    ) {
        static BudgetResponse from(BudgetSummary summary) {
            return new BudgetResponse(
                    summary.budget(),
                    summary.currentSpend(),
                    summary.utilizationPercentage(),
                    summary.alerts().stream().map(AlertResponse::from).toList()
            );
        }
    }
}
