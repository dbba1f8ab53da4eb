package com.studiobooking.orchestrator.config;

import java.time.LocalTime;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "studio")
public record StudioProperties(
    String name, String address, String phone, ZoneId timezone, LocalTime defaultClassTime) {

  public StudioProperties {
    if (name == null) name = "";
    if (address == null) address = "";
    if (phone == null) phone = "";
    if (timezone == null) timezone = ZoneId.of("Asia/Vladivostok");
    if (defaultClassTime == null) defaultClassTime = LocalTime.of(19, 0);
  }
}
