/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.config;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.support.CronExpression;

/**
 * CRON dialect utilities. Schedules are written in the six fields dialect "second minute hour day-of-month month
 * day-of-week", where Sunday is either 0 or 7. The work queue runs the Quartz dialect where Sunday is 1 and one of the
 * day fields must be "?".
 */
public final class CronPatterns {

	private static final String ALL = "*";

	private static final String NO_SPEC = "?";

	private static final Map<String, String> MACROS = Map.of("@yearly", "0 0 0 1 1 *", "@annually", "0 0 0 1 1 *",
			"@monthly", "0 0 0 1 * *", "@weekly", "0 0 0 * * 0", "@daily", "0 0 0 * * *", "@midnight", "0 0 0 * * *",
			"@hourly", "0 0 * * * *");

	/**
	 * 2024-01-01 is a Monday.
	 */
	private static final LocalDateTime WEEK_START = LocalDateTime.of(2024, 1, 1, 0, 0).minusSeconds(1);

	private CronPatterns() {
		// Utility class
	}

	/**
	 * Return the six fields form of the given expression. Macros are expanded, and when the expression has only five
	 * fields, the missing "seconds" part is prepended.
	 *
	 * @param cron The CRON expression. May be <code>null</code>.
	 * @return The normalized expression, or <code>null</code>.
	 */
	public static String normalize(final String cron) {
		if (StringUtils.isBlank(cron)) {
			return cron;
		}
		final var trimmed = cron.trim();
		final var macro = MACROS.get(trimmed.toLowerCase());
		if (macro != null) {
			return macro;
		}
		final var fields = StringUtils.split(trimmed);
		if (fields.length == 5) {
			// Add the missing "seconds" part
			return "0 " + String.join(" ", fields);
		}
		return String.join(" ", fields);
	}

	/**
	 * Convert a six fields expression to the Quartz dialect.
	 *
	 * @param cron The six fields CRON expression.
	 * @return The Quartz expression.
	 * @throws IllegalArgumentException When the expression cannot be expressed in the Quartz dialect.
	 */
	public static String toQuartz(final String cron) {
		final var fields = StringUtils.split(normalize(cron));
		if (fields == null || fields.length != 6) {
			throw new IllegalArgumentException("CRON expression must consist of 6 fields, got '" + cron + "'");
		}
		var dayOfMonth = fields[3];
		var dayOfWeek = toQuartzDays(fields[5]);
		if (!NO_SPEC.equals(dayOfMonth) && !NO_SPEC.equals(dayOfWeek)) {
			if (ALL.equals(dayOfWeek)) {
				dayOfWeek = NO_SPEC;
			} else if (ALL.equals(dayOfMonth)) {
				dayOfMonth = NO_SPEC;
			} else {
				throw new IllegalArgumentException(
						"Day-of-month and day-of-week cannot be both restricted in '" + cron + "'");
			}
		}
		return String.join(" ", fields[0], fields[1], fields[2], dayOfMonth, fields[4], dayOfWeek);
	}

	private static String toQuartzDays(final String field) {
		if (ALL.equals(field) || NO_SPEC.equals(field)) {
			return field;
		}
		if (StringUtils.containsAny(field, '#', 'L')) {
			return toQuartzDay(field);
		}

		// Let the six fields parser compute the selected days, then list them
		final var selector = CronExpression.parse("0 0 0 * * " + field);
		final var days = new TreeSet<Integer>();
		var date = WEEK_START;
		for (var i = 0; i < 7; i++) {
			date = selector.next(date);
			days.add(date.getDayOfWeek().getValue() % 7 + 1);
		}
		if (days.size() == 7) {
			return ALL;
		}
		return days.stream().map(String::valueOf).collect(Collectors.joining(","));
	}

	/**
	 * Translate the single day of a "5#3" or "5L" form.
	 */
	private static String toQuartzDay(final String field) {
		final var end = StringUtils.indexOfAny(field, '#', 'L');
		final var day = field.substring(0, end);
		if (StringUtils.isNumeric(day) && !day.isEmpty()) {
			return (Integer.parseInt(day) % 7 + 1) + field.substring(end);
		}
		return field;
	}
}
