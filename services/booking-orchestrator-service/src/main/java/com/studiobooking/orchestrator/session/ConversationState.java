package com.studiobooking.orchestrator.session;

public enum ConversationState {
  IDLE,
  COLLECTING_INTENT,
  BROWSING_SCHEDULE,
  COLLECTING_GROUP,
  COLLECTING_DATETIME,
  COLLECTING_CONTACT,
  CONFIRM_BOOKING,
  BOOKING_IN_PROGRESS,
  BOOKING_DONE,
  CANCEL_FLOW,
  SERIAL_BOOKING,
  HANDOFF_TO_ADMIN,
  ADMIN_RESPONDING
}
