package io.pulse4j.utils;

import io.pulse4j.core.BusinessHoursWindow;
import io.pulse4j.core.CronRule;
import io.pulse4j.core.IntervalRule;
import io.pulse4j.core.RecurrenceRule;
import io.pulse4j.core.WeeklyRule;
import io.pulse4j.core.WindowPolicy;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleParserTest {

    private static final ZoneId ZONE = ZoneId.of("America/Fortaleza");

    @Test
    void parseHumanDurationShouldWork() {
        assertEquals(Duration.ofMinutes(5), ScheduleParser.parseHumanDuration("5 minutes"));
        assertEquals(Duration.ofMinutes(90), ScheduleParser.parseHumanDuration("1 hour 30 minutes"));
        assertEquals(Duration.ofMinutes(40), ScheduleParser.parseHumanDuration("40m"));
        assertEquals(Duration.ofSeconds(1800), ScheduleParser.parseHumanDuration("1800"));
    }

    @Test
    void parseHumanDurationShouldRejectDuplicateUnits() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parseHumanDuration("1 hour 2 hours"));
    }

    @Test
    void intervalSpecShouldProduceIntervalRule() {
        RecurrenceRule rule = ScheduleParser.parseRecurrence("every 50 minutes", ZONE);
        assertEquals(new IntervalRule(Duration.ofMinutes(50)), rule);
    }

    @Test
    void weeklySpecShouldProduceWeeklyRule() {
        RecurrenceRule rule = ScheduleParser.parseRecurrence("MON-SAT AT 11:30,17:30", ZONE);

        WeeklyRule weekly = assertInstanceOf(WeeklyRule.class, rule);
        assertEquals(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.SATURDAY), weekly.days());
        assertEquals(List.of(LocalTime.of(11, 30), LocalTime.of(17, 30)), List.copyOf(weekly.times()));
        assertEquals(ZONE, weekly.zone());
    }

    @Test
    void weeklySpecShouldAcceptDayListsAndFullNames() {
        WeeklyRule rule = (WeeklyRule) ScheduleParser.parseRecurrence("monday,Wednesday at 9:00", ZONE);
        assertEquals(EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY), rule.days());
        assertEquals(LocalTime.of(9, 0), rule.times().first());
    }

    @Test
    void dailySpecShouldCoverEveryDay() {
        WeeklyRule rule = (WeeklyRule) ScheduleParser.parseRecurrence("DAILY AT 08:00", ZONE);
        assertEquals(EnumSet.allOf(DayOfWeek.class), rule.days());
    }

    @Test
    void dayRangesMayWrapAroundTheWeek() {
        assertEquals(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY, DayOfWeek.MONDAY),
                ScheduleParser.parseDays("SAT-MON"));
    }

    @Test
    void fiveFieldCronShouldProduceCronRule() {
        CronRule rule = assertInstanceOf(CronRule.class, ScheduleParser.parseRecurrence("*/5 * * * *", ZONE));
        assertEquals("0 */5 * * * ?", rule.expression());
    }

    @Test
    void cronWithDayOfWeekShouldUseQuestionMarkForDayOfMonth() {
        assertEquals("0 30 11 ? * MON-SAT", ScheduleParser.normalizeCron("30 11 * * MON-SAT"));
    }

    @Test
    void looksLikeCronShouldRecognizeValidSpec() {
        assertTrue(ScheduleParser.looksLikeCron("0 */10 * * * *"));
        assertFalse(ScheduleParser.looksLikeCron("30 minutes"));
    }

    @Test
    void invalidRecurrenceShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parseRecurrence("whenever", ZONE));
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parseRecurrence("FUNDAY AT 10:00", ZONE));
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parseRecurrence("MON AT 25:00", ZONE));
        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parseRecurrence("  ", ZONE));
    }

    @Test
    void windowSpecs() {
        assertSame(WindowPolicy.always(), ScheduleParser.parseWindow("always", ZONE));
        assertEquals(BusinessHoursWindow.defaults(ZONE), ScheduleParser.parseWindow("default", ZONE));

        BusinessHoursWindow custom = (BusinessHoursWindow) ScheduleParser.parseWindow("MON-FRI 08:00-18:00", ZONE);
        assertEquals(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY), custom.openDays());
        assertEquals(LocalTime.of(8, 0), custom.opensAt());
        assertEquals(LocalTime.of(18, 0), custom.closesAt());

        assertThrows(IllegalArgumentException.class, () -> ScheduleParser.parseWindow("weekdays", ZONE));
    }
}
