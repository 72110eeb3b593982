package com.agentrunner.service;

import org.springframework.scheduling.support.CronExpression;

import java.time.temporal.Temporal;

/**
 * A 5-field Unix cron expression (minute hour day-of-month month day-of-week) evaluated with
 * Spring's {@link CronExpression}.
 * <p>
 * Spring always ANDs the day-of-month and day-of-week fields. Unix cron ORs them when both are
 * restricted, so in that case the expression is split in two and the earlier match wins.
 */
public final class CronSchedule {

    private static final int FIELD_COUNT = 5;

    private final String expression;
    private final CronExpression primary;
    private final CronExpression alternate;

    private CronSchedule(String expression, CronExpression primary, CronExpression alternate) {
        this.expression = expression;
        this.primary = primary;
        this.alternate = alternate;
    }

    /**
     * @throws IllegalArgumentException when the expression is blank, does not have exactly five
     *                                  fields, or any field is out of range
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression must not be empty");
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        if (fields.length != FIELD_COUNT) {
            throw new IllegalArgumentException("Cron expression must have 5 fields (minute hour day-of-month month day-of-week), got "
                    + fields.length + " in '" + trimmed + "'");
        }

        String minute = fields[0];
        String hour = fields[1];
        String dayOfMonth = fields[2];
        String month = fields[3];
        String dayOfWeek = fields[4];

        if (isRestricted(dayOfMonth) && isRestricted(dayOfWeek)) {
            CronExpression byDayOfMonth = CronExpression.parse(String.join(" ", "0", minute, hour, dayOfMonth, month, "*"));
            CronExpression byDayOfWeek = CronExpression.parse(String.join(" ", "0", minute, hour, "*", month, dayOfWeek));
            return new CronSchedule(trimmed, byDayOfMonth, byDayOfWeek);
        }
        return new CronSchedule(trimmed, CronExpression.parse("0 " + trimmed), null);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Next fire time strictly after {@code from}, or {@code null} if the expression never matches again.
     */
    public <T extends Temporal & Comparable<? super T>> T next(T from) {
        T first = primary.next(from);
        if (alternate == null) {
            return first;
        }
        T second = alternate.next(from);
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return first.compareTo(second) <= 0 ? first : second;
    }

    public String getExpression() {
        return expression;
    }

    private static boolean isRestricted(String field) {
        return !field.startsWith("*") && !field.equals("?");
    }

    @Override
    public String toString() {
        return expression;
    }
}
