package com.studiobooking.orchestrator.crm.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One class occurrence. {@code date} is {@code yyyy-MM-dd}, {@code time} is {@code HH:mm}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScheduleEntry(
    long id,
    @JsonProperty("group_id") Long groupId,
    @JsonProperty("teacher_id") Long teacherId,
    @JsonProperty("hall_id") Long hallId,
    String date,
    String time,
    @JsonProperty("duration_minutes") Integer durationMinutes,
    @JsonProperty("max_students") Integer maxStudents,
    @JsonProperty("current_students") Integer currentStudents,
    @JsonProperty("is_active") Boolean active) {

  public static final String[] FIELDS = {
    "id",
    "group_id",
    "teacher_id",
    "hall_id",
    "date",
    "time",
    "duration_minutes",
    "max_students",
    "current_students",
    "is_active"
  };

  /** Time trimmed to {@code HH:mm}; the CRM sometimes sends seconds. */
  public String hourMinute() {
    if (time == null) {
      return null;
    }
    return time.length() > 5 ? time.substring(0, 5) : time;
  }
}
