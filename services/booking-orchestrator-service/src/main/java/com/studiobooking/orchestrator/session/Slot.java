package com.studiobooking.orchestrator.session;

/** Required booking slots, in the order they are asked for. */
public enum Slot {
  GROUP("направление"),
  DATETIME("дата и время"),
  NAME("имя"),
  PHONE("телефон");

  private final String label;

  Slot(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
