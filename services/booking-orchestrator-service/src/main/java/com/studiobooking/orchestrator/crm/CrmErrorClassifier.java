package com.studiobooking.orchestrator.crm;

import java.util.Locale;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/** Maps a CRM exception to a failure kind and the message the client gets to see. */
@Component
public class CrmErrorClassifier {

  static final String MSG_SERVER = "Технический сбой. Записал заявку — администратор подтвердит.";
  static final String MSG_TIMEOUT =
      "Превышено время ожидания. Записал заявку — администратор подтвердит.";
  static final String MSG_BREAKER =
      "Сервис временно недоступен. Записал заявку — администратор подтвердит.";
  static final String MSG_NOT_FOUND = "Расписание изменилось. Показать актуальное расписание?";
  static final String MSG_CLIENT =
      "Ошибка при обработке запроса. Попробуйте еще раз или обратитесь к администратору.";
  static final String MSG_NO_SEATS =
      "Нет мест на это время. Предлагаю ближайшие доступные варианты.";
  static final String MSG_ALREADY_BOOKED =
      "Вы уже записаны на это занятие! Хотите записаться на другое время?";
  static final String MSG_CLASS_PASSED =
      "Это время уже прошло. Предлагаю ближайшее доступное занятие.";
  static final String MSG_GROUP_FULL =
      "Группа полная. Хотите встать в лист ожидания или выбрать другое время?";
  static final String MSG_UNKNOWN = "Произошла ошибка. Записал заявку — администратор подтвердит.";

  public record Classification(CrmFailureKind kind, String userMessage, boolean shouldFallback) {}

  public Classification classify(Throwable error) {
    if (error instanceof CircuitBreakerOpenException) {
      return of(CrmFailureKind.BREAKER_OPEN, MSG_BREAKER, true);
    }
    if (error instanceof ResourceAccessException) {
      // connection refused and read timeouts both end up here after retries
      return of(CrmFailureKind.TIMEOUT, MSG_TIMEOUT, true);
    }

    int status = 0;
    String text = String.valueOf(error.getMessage());
    if (error instanceof RestClientResponseException http) {
      status = http.getStatusCode().value();
      text = text + " " + http.getResponseBodyAsString();
    }
    if (status >= 500) {
      return of(CrmFailureKind.SERVER_ERROR, MSG_SERVER, true);
    }
    if (status == 404) {
      return of(CrmFailureKind.NOT_FOUND, MSG_NOT_FOUND, false);
    }

    // auth failures never carry booking semantics, whatever the body says
    if (status == 401 || status == 403) {
      return of(CrmFailureKind.CLIENT_ERROR, MSG_CLIENT, false);
    }
    Classification byText = classifyText(text.toLowerCase(Locale.ROOT));
    if (byText != null) {
      return byText;
    }
    if (status == 400) {
      return of(CrmFailureKind.CLIENT_ERROR, MSG_CLIENT, false);
    }
    return of(CrmFailureKind.UNKNOWN, MSG_UNKNOWN, true);
  }

  private static Classification classifyText(String s) {
    if (s.contains("группа заполнена") || s.contains("group is full")) {
      return of(CrmFailureKind.GROUP_FULL, MSG_GROUP_FULL, false);
    }
    if (s.contains("нет мест") || s.contains("no seats") || s.contains("no free places")) {
      return of(CrmFailureKind.NO_SEATS, MSG_NO_SEATS, false);
    }
    if (s.contains("уже записан") || s.contains("already booked")) {
      return of(CrmFailureKind.ALREADY_BOOKED, MSG_ALREADY_BOOKED, false);
    }
    if (s.contains("занятие не найдено") || s.contains("schedule not found")) {
      return of(CrmFailureKind.NOT_FOUND, MSG_NOT_FOUND, false);
    }
    if (s.contains("в прошлом") || s.contains("занятие прошло") || s.contains("in the past")) {
      return of(CrmFailureKind.CLASS_PASSED, MSG_CLASS_PASSED, false);
    }
    return null;
  }

  private static Classification of(CrmFailureKind kind, String msg, boolean fallback) {
    return new Classification(kind, msg, fallback);
  }
}
