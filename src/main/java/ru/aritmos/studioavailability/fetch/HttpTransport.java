package ru.aritmos.studioavailability.fetch;

import java.io.IOException;
import java.time.Duration;

/**
 * Один сетевой обмен с источником, без повторов.
 * <p>
 * Вынесено в интерфейс, чтобы:
 * <ul>
 *   <li>подменять реализацию (прокси, другой HTTP-клиент);</li>
 *   <li>тестировать политику повторов без реальных сетевых вызовов.</li>
 * </ul>
 * Реализация не интерпретирует HTTP-статус: это делает {@link ResilientFetchClient}.
 */
public interface HttpTransport {

    /**
     * Выполнить запрос.
     *
     * @param request запрос
     * @param readTimeout таймаут ожидания ответа для этой попытки
     * @return ответ с любым HTTP-статусом
     * @throws IOException ошибка соединения или таймаут
     * @throws InterruptedException поток прерван во время ожидания
     */
    FetchResponse exchange(FetchRequest request, Duration readTimeout) throws IOException, InterruptedException;
}
