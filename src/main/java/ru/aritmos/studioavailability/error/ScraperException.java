package ru.aritmos.studioavailability.error;

/**
 * Базовое исключение слоя сбора доступности студий.
 * <p>
 * Все ошибки коннекторов, клиента загрузки, реестра и алгоритма подбора наследуются от него,
 * поэтому вызывающий код может перехватывать один тип.
 */
public class ScraperException extends RuntimeException {

    public ScraperException(String message) {
        super(message);
    }

    public ScraperException(String message, Throwable cause) {
        super(message, cause);
    }
}
