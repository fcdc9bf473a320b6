package com.teamA.cra.common.notification.digest;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * 이벤트 시각 -> digestDate (yyyy-MM-dd, 업무 시간대 기준)
 *
 * cutoff 시각 "이후"(같은 시각 포함)는 다음 날 digest로 넘어간다.
 * ex) cutoff 16: 15:59:59 -> D, 16:00:00 -> D+1
 */
public class DigestDateCalculator {

    public static final int DEFAULT_CUTOFF_HOUR = 16;

    private final ZoneId zoneId;
    private final int cutoffHour;

    public DigestDateCalculator(ZoneId zoneId, int cutoffHour) {
        if (zoneId == null) throw new IllegalArgumentException("zoneId is required");
        if (cutoffHour < 0 || cutoffHour > 23) {
            throw new IllegalArgumentException("cutoffHour must be within 0..23: " + cutoffHour);
        }
        this.zoneId = zoneId;
        this.cutoffHour = cutoffHour;
    }

    public String digestDate(long eventAtMillis) {
        ZonedDateTime local = Instant.ofEpochMilli(eventAtMillis).atZone(zoneId);
        LocalDate day = local.toLocalDate();
        if (local.getHour() >= cutoffHour) {
            day = day.plusDays(1);
        }
        return day.toString();
    }

    public ZoneId zoneId() {
        return zoneId;
    }
}
