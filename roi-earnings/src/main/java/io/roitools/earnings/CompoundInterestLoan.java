package io.roitools.earnings;

/*
 * Copyright (c) roitools
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/**
 * Fixed-payment loan arithmetic with interest compounded once per period.
 *
 * <p>Every method is period-agnostic: years, months or semesters all work, as long
 * as the rate, the duration and the payment refer to the same period.
 *
 * <pre>
 *   payment          = P·r / (1 - (1 + r)^-n)          (P/n when r = 0)
 *   still to be paid = payment · (n - k)               after k payments
 *   periods to repay = -ln(1 - r·B/payment) / ln(1 + r)
 * </pre>
 */
public final class CompoundInterestLoan {

    private CompoundInterestLoan() {}

    /**
     * Equal payment per period that repays the principal with interest in exactly
     * {@code duration} periods.
     *
     * @param principal amount borrowed
     * @param rate interest per period, e.g. 0.05 for 5%
     * @param duration number of periods
     * @return the payment per period
     * @throws IllegalArgumentException if the duration is not positive or the rate is -100% or less
     */
    public static double periodPayment(double principal, double rate, double duration) {
        requirePositiveDuration(duration);
        requireRate(rate);
        if (rate == 0.0) {
            return principal / duration;
        }
        return principal * rate / (1 - Math.pow(1 + rate, -duration));
    }

    /**
     * Total the borrower still pays, future interest included, after
     * {@code periodsPassed} payments. Works from any balance, not only the principal
     * at origination, with {@code duration} the periods left on it.
     *
     * @param principal amount borrowed, or the current balance
     * @param rate interest per period
     * @param duration number of periods of the loan
     * @param periodsPassed payments already made, between 0 and the duration
     * @return the sum of the remaining payments
     * @throws IllegalArgumentException if {@code periodsPassed} is outside {@code [0, duration]}
     */
    public static double amountToBePaidAfter(double principal, double rate, double duration,
                                             double periodsPassed) {
        if (!(periodsPassed >= 0 && periodsPassed <= duration)) {
            throw new IllegalArgumentException(
                "periodsPassed must be between 0 and the duration " + duration + ", was " + periodsPassed);
        }
        return periodPayment(principal, rate, duration) * (duration - periodsPassed);
    }

    /**
     * Number of periods until the balance reaches zero at a fixed payment. The result
     * is fractional when the last payment is partial.
     *
     * @param currentBalance amount owed now, future interest excluded
     * @param rate interest per period
     * @param payment amount paid each period
     * @return periods to repay, {@link Double#POSITIVE_INFINITY} when the payment does not
     *     cover the interest
     * @throws IllegalArgumentException if the payment is not positive or the rate is -100% or less
     */
    public static double periodsToPayOff(double currentBalance, double rate, double payment) {
        if (!(payment > 0)) {
            throw new IllegalArgumentException("payment must be positive, was " + payment);
        }
        requireRate(rate);
        if (currentBalance <= 0) {
            return 0.0;
        }
        if (rate == 0.0) {
            return currentBalance / payment;
        }
        double remainder = 1 - rate * currentBalance / payment;
        if (remainder <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return -Math.log(remainder) / Math.log(1 + rate);
    }

    private static void requirePositiveDuration(double duration) {
        if (!(duration > 0)) {
            throw new IllegalArgumentException("duration must be positive, was " + duration);
        }
    }

    private static void requireRate(double rate) {
        if (!(rate > -1)) {
            throw new IllegalArgumentException("rate must be greater than -1, was " + rate);
        }
    }
}
