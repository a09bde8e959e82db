package ru.aritmos.studioavailability;

import io.micronaut.runtime.Micronaut;

/**
 * Точка входа сервиса доступности репетиционных студий.
 * <p>
 * Сервис собирает расписания нескольких сетей студий, приводит их к единой модели комнат и слотов
 * и подбирает окна под желаемый диапазон и длительность.
 */
public final class Application {

    private Application() {
        // утилитарный класс
    }

    public static void main(String[] args) {
        Micronaut.run(Application.class, args);
    }
}
