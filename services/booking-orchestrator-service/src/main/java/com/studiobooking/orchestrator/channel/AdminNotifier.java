package com.studiobooking.orchestrator.channel;

/** Best-effort operator alerts. Implementations never throw. */
public interface AdminNotifier {

  void notifyAdmin(String text);
}
