package com.flagship.transaction_etl.extract;

import lombok.Value;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Date window requested from the transaction source. Both bounds are inclusive.
 */
@Value
public class ExtractionRequest {
    LocalDate startDate;
    LocalDate endDate;

    public ExtractionRequest(LocalDate startDate, LocalDate endDate) {
        this.startDate = Objects.requireNonNull(startDate, "startDate");
        this.endDate = Objects.requireNonNull(endDate, "endDate");
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException(
                String.format("endDate %s is before startDate %s", endDate, startDate));
        }
    }

    @Override
    public String toString() {
        return startDate + ".." + endDate;
    }
}
