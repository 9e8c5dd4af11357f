package com.chicu.papertradebot.risk;

/**
 * Куда вотчер сообщает о срабатываниях и ошибках.
 * Хост-приложение подключает сюда логи, метрики, алерты.
 */
public interface RiskWatcherListener {

    default void onTriggered(TriggerEvent event) {
    }

    /** закрыть не удалось — позиция остаётся и будет повторена */
    default void onTriggerFailed(TriggerEvent event, Exception error) {
    }

    /** проход прерван целиком (загрузка позиций / цена) */
    default void onPassFailed(Exception error) {
    }
}
