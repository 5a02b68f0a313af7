package com.cpi.async.service;

import com.cpi.async.domain.CalculationOutcome;
import com.cpi.async.domain.CategoryRecord;
import com.cpi.async.domain.RequestData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Computes the personal price index of one application.
 * <p>
 * {@code index = 100 * Σ w_i * (P_i(t1) - P_i(t0)) / P_i(t0)} where
 * {@code w_i = userSpent_i / totalSpent}, {@code P_i(t1) = userSpent_i} and
 * {@code P_i(t0) = basePrice_i}. Only categories with a positive spend and a
 * positive base price contribute; the weights of the others are not
 * redistributed, so contributing weights may sum to less than one.
 * <p>
 * The result is rounded HALF_UP to two decimal places. Stateless and thread-safe.
 */
@Component
@Slf4j
public class PersonalIndexCalculator {

    private static final MathContext MATH_CONTEXT = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int SCALE = 2;

    /**
     * Computes the outcome for the given request data.
     *
     * @param requestId identifier copied into the outcome
     * @param data      fetched categories
     * @return a successful outcome, or a failed one when nothing could be computed
     */
    public CalculationOutcome compute(String requestId, RequestData data) {
        List<CategoryRecord> categories = data.categories();
        if (categories.isEmpty()) {
            log.info("No categories found for request {}", requestId);
            return CalculationOutcome.failure(requestId);
        }

        BigDecimal totalSpent = categories.stream()
                .map(CategoryRecord::userSpentOrZero)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        log.debug("Request {}: total spent = {}", requestId, totalSpent);

        if (totalSpent.signum() == 0) {
            log.info("Total spent is 0 for request {}", requestId);
            return CalculationOutcome.failure(requestId);
        }

        BigDecimal index = BigDecimal.ZERO;
        boolean hasValidCategories = false;

        for (CategoryRecord category : categories) {
            BigDecimal userSpent = category.userSpentOrZero();
            BigDecimal basePrice = category.basePriceOrZero();

            if (basePrice.signum() > 0 && userSpent.signum() > 0) {
                BigDecimal weight = userSpent.divide(totalSpent, MATH_CONTEXT);
                BigDecimal change = userSpent.subtract(basePrice).divide(basePrice, MATH_CONTEXT);
                index = index.add(weight.multiply(change, MATH_CONTEXT), MATH_CONTEXT);
                hasValidCategories = true;
                log.debug("Category {}: weight={}, change={}", category.id(),
                        weight.setScale(4, RoundingMode.HALF_UP),
                        change.setScale(4, RoundingMode.HALF_UP));
            }
        }

        if (!hasValidCategories) {
            log.info("No valid categories with basePrice > 0 for request {}", requestId);
            return CalculationOutcome.failure(requestId);
        }

        BigDecimal personalIndex = index.multiply(HUNDRED).setScale(SCALE, RoundingMode.HALF_UP);
        log.info("Request {}: calculated personal index = {}%", requestId, personalIndex);
        return CalculationOutcome.success(requestId, personalIndex);
    }
}
