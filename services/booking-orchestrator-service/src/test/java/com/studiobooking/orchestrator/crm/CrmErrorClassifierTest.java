package com.studiobooking.orchestrator.crm;

import static org.assertj.core.api.Assertions.assertThat;

import com.studiobooking.orchestrator.crm.CrmErrorClassifier.Classification;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

class CrmErrorClassifierTest {

  private final CrmErrorClassifier classifier = new CrmErrorClassifier();

  @Test
  void serverErrorsAreQueuedForReconciliation() {
    Classification c =
        classifier.classify(HttpServerErrorException.create(HttpStatus.BAD_GATEWAY, "Bad Gateway",
            HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8));

    assertThat(c.kind()).isEqualTo(CrmFailureKind.SERVER_ERROR);
    assertThat(c.shouldFallback()).isTrue();
    assertThat(c.userMessage()).isEqualTo(CrmErrorClassifier.MSG_SERVER);
  }

  @Test
  void timeoutsAndOpenBreakerAreQueued() {
    assertThat(classifier.classify(new ResourceAccessException("Read timed out")).kind())
        .isEqualTo(CrmFailureKind.TIMEOUT);
    Classification open = classifier.classify(new CircuitBreakerOpenException("open"));
    assertThat(open.kind()).isEqualTo(CrmFailureKind.BREAKER_OPEN);
    assertThat(open.shouldFallback()).isTrue();
  }

  @Test
  void notFoundIsNotQueued() {
    Classification c = classifier.classify(clientError(HttpStatus.NOT_FOUND, "{}"));

    assertThat(c.kind()).isEqualTo(CrmFailureKind.NOT_FOUND);
    assertThat(c.shouldFallback()).isFalse();
  }

  @Test
  void domainTextWinsOverTheGenericClientError() {
    assertThat(
            classifier
                .classify(clientError(HttpStatus.BAD_REQUEST, "{\"error\":\"нет мест\"}"))
                .kind())
        .isEqualTo(CrmFailureKind.NO_SEATS);
    assertThat(classifier.classify(clientError(HttpStatus.CONFLICT, "Клиент уже записан")).kind())
        .isEqualTo(CrmFailureKind.ALREADY_BOOKED);
    assertThat(classifier.classify(clientError(HttpStatus.BAD_REQUEST, "Группа заполнена")).kind())
        .isEqualTo(CrmFailureKind.GROUP_FULL);
    assertThat(
            classifier
                .classify(clientError(HttpStatus.UNPROCESSABLE_ENTITY, "Занятие в прошлом"))
                .kind())
        .isEqualTo(CrmFailureKind.CLASS_PASSED);
  }

  @Test
  void plainBadRequestIsAClientError() {
    Classification c = classifier.classify(clientError(HttpStatus.UNAUTHORIZED, "{}"));

    assertThat(c.kind()).isEqualTo(CrmFailureKind.CLIENT_ERROR);
    assertThat(c.shouldFallback()).isFalse();
  }

  @Test
  void authFailureIsAClientErrorWhateverTheBodySays() {
    Classification c =
        classifier.classify(
            clientError(HttpStatus.UNAUTHORIZED, "{\"error\":\"API token expired\"}"));

    assertThat(c.kind()).isEqualTo(CrmFailureKind.CLIENT_ERROR);
    assertThat(c.userMessage()).isEqualTo(CrmErrorClassifier.MSG_CLIENT);
    assertThat(classifier.classify(clientError(HttpStatus.FORBIDDEN, "нет мест")).kind())
        .isEqualTo(CrmFailureKind.CLIENT_ERROR);
  }

  @Test
  void fieldNamesAreNotMistakenForBookingErrors() {
    Classification c =
        classifier.classify(
            clientError(HttpStatus.BAD_REQUEST, "{\"error\":\"full_name is required\"}"));

    assertThat(c.kind()).isEqualTo(CrmFailureKind.CLIENT_ERROR);
  }

  @Test
  void anythingElseIsUnknownAndQueued() {
    Classification c = classifier.classify(new IllegalStateException("boom"));

    assertThat(c.kind()).isEqualTo(CrmFailureKind.UNKNOWN);
    assertThat(c.shouldFallback()).isTrue();
  }

  private static HttpClientErrorException clientError(HttpStatus status, String body) {
    return HttpClientErrorException.create(
        status,
        status.getReasonPhrase(),
        HttpHeaders.EMPTY,
        body.getBytes(StandardCharsets.UTF_8),
        StandardCharsets.UTF_8);
  }
}
