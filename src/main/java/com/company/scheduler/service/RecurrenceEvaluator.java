package com.company.scheduler.service;

import com.company.scheduler.domain.RecurrenceSchedule;
import com.company.scheduler.domain.enums.ScheduleFrequency;
import com.company.scheduler.util.LocalTimeConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Computes the next fire instant of a recurrence schedule.
 * An empty result means the schedule is exhausted (past its stop date).
 * Pure: the same schedule and "now" always give the same answer.
 */
@Service
@Slf4j
public class RecurrenceEvaluator {

    static final LocalTime DEFAULT_TIME_OF_DAY = LocalTime.of(8, 0);
    static final int DEFAULT_DAY_OF_WEEK = 1;
    static final int DEFAULT_DAY_OF_MONTH = 1;

    public Optional<Instant> nextFireInstant(RecurrenceSchedule schedule, Instant now) {
        if (schedule == null || now == null) {
            return Optional.empty();
        }

        int offsetMinutes = schedule.getTimezoneOffsetMinutes() != null
                ? schedule.getTimezoneOffsetMinutes() : 0;
        LocalDateTime localNow = LocalTimeConverter.toLocal(now, offsetMinutes);
        LocalTime timeOfDay = parseTimeOfDay(schedule.getTimeOfDay());
        LocalDateTime localStopAt = parseStopAt(schedule.getStopDate());

        if (localStopAt != null && !localNow.isBefore(localStopAt)) {
            return Optional.empty();
        }

        LocalDateTime candidate = ScheduleFrequency.fromString(schedule.getFrequency()) == ScheduleFrequency.MONTHLY
                ? nextMonthly(localNow, timeOfDay, dayOfMonth(schedule))
                : nextWeekly(localNow, timeOfDay, dayOfWeek(schedule));

        if (localStopAt != null && candidate.isAfter(localStopAt)) {
            return Optional.empty();
        }

        return Optional.of(LocalTimeConverter.toInstant(candidate, offsetMinutes));
    }

    private LocalDateTime nextWeekly(LocalDateTime localNow, LocalTime timeOfDay, DayOfWeek target) {
        LocalDateTime candidate = localNow.toLocalDate().atTime(timeOfDay);
        int diff = target.getValue() - localNow.getDayOfWeek().getValue();
        // Today only counts while its slot is still ahead of local now
        if (diff < 0 || (diff == 0 && !candidate.isAfter(localNow))) {
            diff += 7;
        }
        return candidate.plusDays(diff);
    }

    private LocalDateTime nextMonthly(LocalDateTime localNow, LocalTime timeOfDay, int dayOfMonth) {
        YearMonth month = YearMonth.from(localNow);
        LocalDateTime candidate = atClampedDay(month, dayOfMonth, timeOfDay);
        if (!candidate.isAfter(localNow)) {
            candidate = atClampedDay(month.plusMonths(1), dayOfMonth, timeOfDay);
        }
        return candidate;
    }

    private LocalDateTime atClampedDay(YearMonth month, int dayOfMonth, LocalTime timeOfDay) {
        int day = Math.min(dayOfMonth, month.lengthOfMonth());
        return month.atDay(day).atTime(timeOfDay);
    }

    private DayOfWeek dayOfWeek(RecurrenceSchedule schedule) {
        Integer raw = schedule.getDayOfWeek();
        if (raw == null || raw < 1 || raw > 7) {
            return DayOfWeek.of(DEFAULT_DAY_OF_WEEK);
        }
        return DayOfWeek.of(raw);
    }

    private int dayOfMonth(RecurrenceSchedule schedule) {
        Integer raw = schedule.getDayOfMonth();
        if (raw == null || raw < 1 || raw > 31) {
            return DEFAULT_DAY_OF_MONTH;
        }
        return raw;
    }

    /**
     * "HH:MM" with hour 0-23 and minute 0-59; anything else falls back to 08:00.
     */
    LocalTime parseTimeOfDay(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_TIME_OF_DAY;
        }
        String[] parts = raw.trim().split(":");
        try {
            int hour = Integer.parseInt(parts[0].trim());
            int minute = parts.length > 1 ? Integer.parseInt(parts[1].trim()) : 0;
            if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
                log.debug("Out of range time of day '{}', using default", raw);
                return DEFAULT_TIME_OF_DAY;
            }
            return LocalTime.of(hour, minute);
        } catch (NumberFormatException e) {
            log.debug("Unparseable time of day '{}', using default", raw);
            return DEFAULT_TIME_OF_DAY;
        }
    }

    /**
     * Last second of the inclusive stop date, or null when unset or unparseable.
     */
    LocalDateTime parseStopAt(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim()).atTime(LocalTime.MAX).truncatedTo(ChronoUnit.SECONDS);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable stop date '{}'", raw);
            return null;
        }
    }
}
