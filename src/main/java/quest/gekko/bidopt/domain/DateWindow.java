package quest.gekko.bidopt.domain;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/** Inclusive range of calendar days. */
public record DateWindow(LocalDate start, LocalDate end) {

    /** The {@code days} most recent fully completed days before {@code today}. */
    public static DateWindow trailing(LocalDate today, int days) {
        LocalDate end = today.minusDays(1);
        return new DateWindow(end.minusDays(days - 1L), end);
    }

    public static DateWindow singleDay(LocalDate day) {
        return new DateWindow(day, day);
    }

    public int days() {
        return (int) ChronoUnit.DAYS.between(start, end) + 1;
    }
}
