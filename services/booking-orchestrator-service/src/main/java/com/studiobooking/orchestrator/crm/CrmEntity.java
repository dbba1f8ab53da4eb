package com.studiobooking.orchestrator.crm;

/** CRM entity names as used in request paths, plus the cache namespace for cached ones. */
public enum CrmEntity {
  SCHEDULE("schedule", "schedule"),
  GROUP("group", "groups"),
  TEACHER("teacher", "teachers"),
  CLIENT("client", null),
  RESERVATION("reservation", null);

  private final String path;
  private final String cacheName;

  CrmEntity(String path, String cacheName) {
    this.path = path;
    this.cacheName = cacheName;
  }

  public String path() {
    return path;
  }

  public String cacheName() {
    return cacheName;
  }
}
