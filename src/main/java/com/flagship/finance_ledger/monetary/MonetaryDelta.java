package com.flagship.finance_ledger.monetary;

import com.flagship.finance_ledger.transaction.TransactionSource;
import com.flagship.finance_ledger.transaction.TransactionType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Exact decimal-string arithmetic for balance deltas.
 *
 * Values are monetary strings with exactly two fraction digits ("150.00", "-0.10").
 * BigDecimal is used for parsing and comparison only: the addition that changes a
 * balance happens in the database, never here.
 *
 * Sign convention (holder's running balance):
 * - ACCOUNT: INCOME increases, EXPENSE decreases
 * - CREDIT_CARD: EXPENSE increases outstanding debt, INCOME (refund/payment) decreases it
 */
public final class MonetaryDelta {

    public static final String ZERO = "0.00";

    private static final int SCALE = 2;
    // NUMERIC(10,2) column
    private static final int MAX_INTEGER_DIGITS = 8;
    private static final Pattern MONETARY = Pattern.compile("^[+-]?\\d+(\\.\\d{1,2})?$");

    private MonetaryDelta() {
        // Utility class
    }

    /**
     * Normalizes a monetary input into an unsigned two-fraction-digit string.
     *
     * @param value decimal string, optionally signed, at most two fraction digits
     * @return unsigned magnitude, e.g. "150" becomes "150.00"
     * @throws IllegalArgumentException if the value is null, blank, malformed or above 99999999.99
     */
    public static String normalize(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Monetary value is required");
        }
        String trimmed = value.trim();
        if (!MONETARY.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Invalid monetary value: " + value);
        }
        BigDecimal magnitude = new BigDecimal(trimmed).abs().setScale(SCALE, RoundingMode.UNNECESSARY);
        if (magnitude.precision() - magnitude.scale() > MAX_INTEGER_DIGITS) {
            throw new IllegalArgumentException("Monetary value out of range: " + value);
        }
        return magnitude.toPlainString();
    }

    /**
     * Builds the signed balance delta a transaction contributes to its holder.
     */
    public static String signed(TransactionType type, TransactionSource source, String value) {
        String amount = normalize(value);
        boolean increases = source == TransactionSource.ACCOUNT
                ? type == TransactionType.INCOME
                : type == TransactionType.EXPENSE;
        if (increases || isZero(amount)) {
            return amount;
        }
        return "-" + amount;
    }

    public static String invert(String delta) {
        if (isZero(delta)) {
            return ZERO;
        }
        if (delta.startsWith("-")) {
            return delta.substring(1);
        }
        if (delta.startsWith("+")) {
            return "-" + delta.substring(1);
        }
        return "-" + delta;
    }

    public static boolean isZero(String delta) {
        return new BigDecimal(delta).signum() == 0;
    }

    /**
     * Numeric equality, so "150.0" and "150.00" compare equal.
     */
    public static boolean sameAmount(String left, String right) {
        return new BigDecimal(left).compareTo(new BigDecimal(right)) == 0;
    }
}
