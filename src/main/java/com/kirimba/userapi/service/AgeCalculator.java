package com.kirimba.userapi.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Считает полные годы между датой рождения и текущей датой из {@link Clock}.
 */
@Component
@RequiredArgsConstructor
public class AgeCalculator {

    private final Clock clock;

    public int ageOf(LocalDate dateOfBirth) {
        return age(dateOfBirth, LocalDate.now(clock));
    }

    /**
     * Разница лет, уменьшенная на единицу, если (месяц, день) опорной даты ещё не дошли
     * до (месяц, день) рождения. В сам день рождения год уже засчитан.
     * Для дат рождения позже опорной даты результат не определён.
     *
     * @param dateOfBirth   дата рождения
     * @param referenceDate дата, на которую считается возраст
     * @return полных лет
     */
    public static int age(LocalDate dateOfBirth, LocalDate referenceDate) {
        int age = referenceDate.getYear() - dateOfBirth.getYear();
        if (referenceDate.getMonthValue() < dateOfBirth.getMonthValue()
                || (referenceDate.getMonthValue() == dateOfBirth.getMonthValue()
                && referenceDate.getDayOfMonth() < dateOfBirth.getDayOfMonth())) {
            age--;
        }
        return age;
    }
}
