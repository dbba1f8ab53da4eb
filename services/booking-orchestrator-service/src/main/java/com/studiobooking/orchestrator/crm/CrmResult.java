package com.studiobooking.orchestrator.crm;

import java.util.function.Function;

/** Either a value or a classified failure, never both. */
public final class CrmResult<T> {

  private final T value;
  private final CrmFailure failure;

  private CrmResult(T value, CrmFailure failure) {
    this.value = value;
    this.failure = failure;
  }

  public static <T> CrmResult<T> ok(T value) {
    return new CrmResult<>(value, null);
  }

  public static <T> CrmResult<T> failed(CrmFailure failure) {
    return new CrmResult<>(null, failure);
  }

  public boolean isOk() {
    return failure == null;
  }

  /** May be null for a successful lookup that found nothing. */
  public T value() {
    if (failure != null) {
      throw new IllegalStateException("CRM call failed: " + failure.kind());
    }
    return value;
  }

  public CrmFailure failure() {
    return failure;
  }

  public <R> CrmResult<R> map(Function<T, R> fn) {
    return isOk() ? ok(fn.apply(value)) : failed(failure);
  }

  @Override
  public String toString() {
    return isOk() ? "CrmResult[ok]" : "CrmResult[" + failure.kind() + "]";
  }
}
