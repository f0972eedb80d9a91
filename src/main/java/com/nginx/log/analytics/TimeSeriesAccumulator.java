package com.nginx.log.analytics;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Strings;

/**
 * Accumulator for hourly and daily UV/PV. Hours only count requests on the target day;
 * days cover the requested range and are zero-padded.
 */
public class TimeSeriesAccumulator {

    static final int DEFAULT_DAYS = 30;

    private final ZoneId zone;
    private final LocalDate targetDay;
    private final LocalDate firstDay;
    private final LocalDate lastDay;

    private final List<Set<String>> hourlyIps = new ArrayList<>(24);
    private final long[] hourlyPv = new long[24];
    private final Map<LocalDate, Set<String>> dailyIps = new HashMap<>();
    private final Map<LocalDate, Long> dailyPv = new HashMap<>();

    public TimeSeriesAccumulator(long startTime, long endTime, ZoneId zone, Clock clock) {
        this.zone = zone;
        LocalDate today = LocalDate.now(clock.withZone(zone));
        this.targetDay = endTime > 0 ? toDate(endTime) : today;
        if (startTime > 0 && endTime > 0) {
            this.firstDay = toDate(startTime);
            this.lastDay = toDate(endTime);
        } else {
            this.firstDay = today.minusDays(DEFAULT_DAYS);
            this.lastDay = today;
        }
        for (int i = 0; i < 24; i++) {
            hourlyIps.add(new HashSet<>());
        }
    }

    /**
     * Requests without a timestamp or client address are not counted.
     */
    public void accumulate(long timestamp, String ip) {
        if (timestamp <= 0 || Strings.isNullOrEmpty(ip)) {
            return;
        }
        Instant instant = Instant.ofEpochSecond(timestamp);
        LocalDate day = LocalDate.ofInstant(instant, zone);
        if (day.equals(targetDay)) {
            int hour = instant.atZone(zone).getHour();
            hourlyIps.get(hour).add(ip);
            hourlyPv[hour]++;
        }
        dailyIps.computeIfAbsent(day, d -> new HashSet<>()).add(ip);
        dailyPv.merge(day, 1L, Long::sum);
    }

    public List<HourlyStats> getHourlyStats() {
        List<HourlyStats> result = new ArrayList<>(24);
        long dayStart = targetDay.atStartOfDay(zone).toEpochSecond();
        for (int hour = 0; hour < 24; hour++) {
            result.add(new HourlyStats(hour, hourlyIps.get(hour).size(), hourlyPv[hour], dayStart + hour * 3600L));
        }
        return result;
    }

    public List<DailyStats> getDailyStats() {
        List<DailyStats> result = new ArrayList<>();
        for (LocalDate day = firstDay; !day.isAfter(lastDay); day = day.plusDays(1)) {
            Set<String> ips = dailyIps.get(day);
            long pv = dailyPv.getOrDefault(day, 0L);
            result.add(new DailyStats(day.format(DateTimeFormatter.ISO_LOCAL_DATE), ips == null ? 0 : ips.size(), pv,
                    day.atStartOfDay(zone).toEpochSecond()));
        }
        return result;
    }

    public LocalDate getTargetDay() {
        return targetDay;
    }

    private LocalDate toDate(long epochSeconds) {
        return LocalDate.ofInstant(Instant.ofEpochSecond(epochSeconds), zone);
    }
}
