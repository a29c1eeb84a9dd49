package com.flagship.transaction_etl.report;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Validated
public class ReportController {

    private final InsightReportService reportService;

    @GetMapping("/category-totals")
    public List<CategoryTotal> categoryTotals() {
        return reportService.categoryTotals();
    }

    @GetMapping("/top-customers")
    public List<CustomerSpend> topCustomers(
            @RequestParam(defaultValue = "5") @Min(1) @Max(100) int limit) {
        return reportService.topCustomers(limit);
    }

    /**
     * Defaults to the past year.
     */
    @GetMapping("/monthly-trends")
    public List<MonthlyTrend> monthlyTrends(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate since) {
        return reportService.monthlyTrends(since != null ? since : LocalDate.now().minusYears(1));
    }

    @GetMapping("/customer-totals")
    public List<CustomerTransactionTotal> customerTotals() {
        return reportService.customerTotals();
    }
}
