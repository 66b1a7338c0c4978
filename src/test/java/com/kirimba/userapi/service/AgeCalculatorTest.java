package com.kirimba.userapi.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Month;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class AgeCalculatorTest {

    @ParameterizedTest(name = "{0} on {1} -> {2}")
    @CsvSource({
            "1990-05-10, 2024-05-10, 34",
            "1990-05-10, 2024-05-09, 33",
            "1990-05-10, 2024-05-11, 34",
            "1991-12-25, 2024-05-10, 32",
            "2024-01-01, 2024-01-01, 0",
            "2024-03-01, 2024-12-31, 0",
            "2023-12-31, 2024-12-30, 0",
            "2023-12-31, 2024-12-31, 1",
            "1900-01-01, 2024-05-10, 124"
    })
    @DisplayName("Полные годы считаются по паре (месяц, день)")
    void age_knownValues(LocalDate dob, LocalDate reference, int expected) {
        assertThat(AgeCalculator.age(dob, reference)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "born 2000-02-29, on {0} -> {1}")
    @CsvSource({
            "2001-02-28, 0",
            "2001-03-01, 1",
            "2004-02-28, 3",
            "2004-02-29, 4",
            "2023-02-28, 22",
            "2023-03-01, 23"
    })
    @DisplayName("Рождённые 29 февраля: в невисокосный год возраст растёт 1 марта")
    void age_leapDayBirth(LocalDate reference, int expected) {
        assertThat(AgeCalculator.age(LocalDate.of(2000, Month.FEBRUARY, 29), reference)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Возраст растёт ровно один раз в год, в день рождения")
    void age_incrementsOnlyOnBirthday() {
        LocalDate[] births = {
                LocalDate.of(1990, 5, 10),
                LocalDate.of(1985, 1, 1),
                LocalDate.of(1979, 12, 31),
                LocalDate.of(2010, 7, 15)
        };
        for (LocalDate dob : births) {
            LocalDate reference = dob.plusDays(1);
            LocalDate end = dob.plusYears(6);
            while (!reference.isAfter(end)) {
                int today = AgeCalculator.age(dob, reference);
                int yesterday = AgeCalculator.age(dob, reference.minusDays(1));
                boolean birthday = reference.getMonth() == dob.getMonth()
                        && reference.getDayOfMonth() == dob.getDayOfMonth();

                if (birthday) {
                    assertThat(today).as("%s on %s", dob, reference).isEqualTo(yesterday + 1);
                } else {
                    assertThat(today).as("%s on %s", dob, reference).isEqualTo(yesterday);
                }
                reference = reference.plusDays(1);
            }
        }
    }

    @Test
    @DisplayName("ageOf берёт текущую дату из Clock")
    void ageOf_usesInjectedClock() {
        Clock clock = Clock.fixed(LocalDate.of(2024, 5, 9).atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        AgeCalculator calculator = new AgeCalculator(clock);

        assertThat(calculator.ageOf(LocalDate.of(1990, 5, 10))).isEqualTo(33);
        assertThat(calculator.ageOf(LocalDate.of(1990, 5, 9))).isEqualTo(34);
    }
}
