package me.golemcore.agent.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Computes a date relative to today.
 *
 * <p>
 * Non-zero {@code days}/{@code weeks} offsets take precedence over
 * {@code weekday}. A {@code weekday} (0 = Monday .. 6 = Sunday) resolves to
 * the next such day strictly after today. Without arguments the result is
 * today.
 */
@Component
@Slf4j
public class DateCalculationTool implements ToolComponent {

    static final String DEFAULT_FORMAT = "dd/MM/yyyy";

    private final Clock clock;

    public DateCalculationTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("calculate_date")
                .description("Calculate a date relative to today. Non-zero 'days' or 'weeks' take precedence "
                        + "over 'weekday'. To find the next given weekday, leave 'days' and 'weeks' at 0.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "days", Map.of(
                                        "type", "integer",
                                        "description", "Days to add (positive) or subtract (negative)."),
                                "weeks", Map.of(
                                        "type", "integer",
                                        "description", "Weeks to add (positive) or subtract (negative)."),
                                "weekday", Map.of(
                                        "type", "integer",
                                        "description", "Weekday to find: 0=Monday ... 6=Sunday.",
                                        "minimum", 0,
                                        "maximum", 6),
                                "format", Map.of(
                                        "type", "string",
                                        "description", "Output date pattern, default dd/MM/yyyy.")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Long days = longArg(parameters, "days");
        Long weeks = longArg(parameters, "weeks");
        Long weekday = longArg(parameters, "weekday");
        if (days == null || weeks == null) {
            return failure("days and weeks must be between " + Integer.MIN_VALUE + " and " + Integer.MAX_VALUE);
        }
        String pattern = parameters.get("format") instanceof String s && !s.isBlank() ? s : DEFAULT_FORMAT;

        DateTimeFormatter formatter;
        try {
            formatter = DateTimeFormatter.ofPattern(pattern, Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return failure("Invalid date format: " + pattern);
        }

        LocalDate today = LocalDate.now(clock);
        LocalDate result;
        try {
            if (days != 0 || weeks != 0) {
                result = today.plusDays(days).plusWeeks(weeks);
            } else if (parameters.get("weekday") != null) {
                if (weekday == null || weekday < 0 || weekday > 6) {
                    return failure("weekday must be between 0 (Monday) and 6 (Sunday), got "
                            + parameters.get("weekday"));
                }
                result = today.with(TemporalAdjusters.next(DayOfWeek.of(weekday.intValue() + 1)));
            } else {
                result = today;
            }
        } catch (DateTimeException | ArithmeticException e) {
            return failure("Date out of range: " + e.getMessage());
        }

        String formatted;
        try {
            formatted = result.format(formatter);
        } catch (DateTimeException e) {
            return failure("Invalid date format: " + pattern);
        }
        log.debug("[Tools] calculate_date days={}, weeks={}, weekday={} -> {}", days, weeks, weekday, formatted);
        return CompletableFuture.completedFuture(ToolResult.success(formatted, Map.of(
                "date", result.toString(),
                "dayOfWeek", result.getDayOfWeek().name())));
    }

    private static CompletableFuture<ToolResult> failure(String message) {
        return CompletableFuture.completedFuture(ToolResult.failure(message));
    }

    /**
     * Whole-number argument, {@code 0} when absent, {@code null} when it is not
     * an integer within the int range.
     */
    private static Long longArg(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return 0L;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long number = ((Number) value).longValue();
            return number < Integer.MIN_VALUE || number > Integer.MAX_VALUE ? null : number;
        }
        return null;
    }
}
