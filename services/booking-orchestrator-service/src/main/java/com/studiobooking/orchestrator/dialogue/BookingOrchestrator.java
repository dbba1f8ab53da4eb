package com.studiobooking.orchestrator.dialogue;

import com.studiobooking.orchestrator.audit.AuditSink;
import com.studiobooking.orchestrator.budget.BudgetExceededException;
import com.studiobooking.orchestrator.channel.AdminNotifier;
import com.studiobooking.orchestrator.config.StudioProperties;
import com.studiobooking.orchestrator.crm.CrmAdapter;
import com.studiobooking.orchestrator.crm.CrmFailure;
import com.studiobooking.orchestrator.crm.CrmResult;
import com.studiobooking.orchestrator.crm.model.Client;
import com.studiobooking.orchestrator.crm.model.Group;
import com.studiobooking.orchestrator.crm.model.Reservation;
import com.studiobooking.orchestrator.crm.model.ScheduleEntry;
import com.studiobooking.orchestrator.generation.GenerationException;
import com.studiobooking.orchestrator.idempotency.IdempotencyGuard;
import com.studiobooking.orchestrator.idempotency.IdempotencyGuard.LockResult;
import com.studiobooking.orchestrator.session.ChatSessionLock;
import com.studiobooking.orchestrator.session.ChatTurn;
import com.studiobooking.orchestrator.session.ConversationState;
import com.studiobooking.orchestrator.session.ConversationStateMachine;
import com.studiobooking.orchestrator.session.Session;
import com.studiobooking.orchestrator.session.SessionStore;
import com.studiobooking.orchestrator.session.Slot;
import com.studiobooking.orchestrator.session.SlotValues;
import com.studiobooking.orchestrator.temporal.TemporalResolver;
import com.studiobooking.orchestrator.temporal.TemporalResult;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Drives one chat from first message to a committed reservation.
 *
 * <p>Each call loads the session, dispatches on its state, and saves it once at the end. The
 * commit sequence takes the idempotency lock before the reservation is created and gives it back
 * when creation fails.
 */
@Service
@Slf4j
public class BookingOrchestrator {

  static final String MSG_START_BOOKING =
      "Помогу записаться на занятие! Какое направление вас интересует?";
  static final String MSG_HOW_CAN_I_HELP = "Чем могу помочь?";
  static final String MSG_CANCELLED = "Запись отменена. Чем ещё могу помочь?";
  static final String MSG_IN_PROGRESS = "Идёт обработка записи, подождите немного...";
  static final String MSG_FORWARDED = "Ваше сообщение передано администратору.";
  static final String MSG_HANDOFF = "Передал ваш вопрос администратору, он скоро ответит.";
  static final String MSG_NEED_INFO = "Нужна информация: ";
  static final String MSG_INCOMPLETE =
      "Не все данные заполнены. Пожалуйста, укажите направление и дату.";
  static final String MSG_NO_MATCH =
      "Не удалось найти подходящее занятие. Обратитесь к администратору.";
  static final String MSG_BOOKING_FAILED =
      "Произошла ошибка при создании записи. Записал заявку — администратор подтвердит.";
  static final String MSG_BUSY = "Обрабатываю предыдущее сообщение, подождите немного...";
  static final String MSG_BUDGET =
      "Сейчас очень много обращений. Попробуйте написать чуть позже или позвоните нам";
  static final String MSG_GENERATION_FAILED =
      "Не получилось обработать сообщение. Попробуйте ещё раз чуть позже.";
  static final String MSG_UNAVAILABLE =
      "Извините, сейчас не получается обработать сообщение. Попробуйте позже или позвоните нам.";
  static final String MSG_NO_CLASSES =
      "На ближайшие дни занятий не нашлось. Уточните дату или направление?";

  private static final Set<String> AFFIRMATIVE = Set.of("да", "yes", "подтверждаю", "согласен");
  private static final Set<String> NEGATIVE = Set.of("нет", "no", "отмена");
  private static final int SCHEDULE_LISTING_DAYS = 7;
  private static final int SCHEDULE_LISTING_MAX = 10;
  private static final DateTimeFormatter LISTING_FORMAT = DateTimeFormatter.ofPattern("dd.MM");

  private final SessionStore sessions;
  private final ConversationStateMachine fsm;
  private final ChatSessionLock chatLock;
  private final IntentExtractor extractor;
  private final TemporalResolver temporal;
  private final CrmAdapter crm;
  private final IdempotencyGuard idempotency;
  private final ReceiptRenderer receipts;
  private final AdminNotifier adminNotifier;
  private final AuditSink audit;
  private final StudioProperties studio;
  private final Clock clock;
  private final boolean debugCommands;

  public BookingOrchestrator(
      SessionStore sessions,
      ConversationStateMachine fsm,
      ChatSessionLock chatLock,
      IntentExtractor extractor,
      TemporalResolver temporal,
      CrmAdapter crm,
      IdempotencyGuard idempotency,
      ReceiptRenderer receipts,
      AdminNotifier adminNotifier,
      AuditSink audit,
      StudioProperties studio,
      Clock clock,
      @Value("${orchestrator.debug-commands:false}") boolean debugCommands) {
    this.sessions = sessions;
    this.fsm = fsm;
    this.chatLock = chatLock;
    this.extractor = extractor;
    this.temporal = temporal;
    this.crm = crm;
    this.idempotency = idempotency;
    this.receipts = receipts;
    this.adminNotifier = adminNotifier;
    this.audit = audit;
    this.studio = studio;
    this.clock = clock;
    this.debugCommands = debugCommands;
  }

  /** Always returns text for the user, whatever fails underneath. */
  public String processMessage(InboundMessage message, String traceId) {
    MDC.put("traceId", traceId);
    try {
      audit.inbound(message.channel(), message.chatId(), message.text());
      String reply;
      try {
        reply = handleLocked(message, traceId);
      } catch (RuntimeException e) {
        log.error("Message in {}:{} failed", message.channel(), message.chatId(), e);
        audit.error(
            "orchestrator",
            e.getMessage(),
            Map.of(
                "channel",
                String.valueOf(message.channel()),
                "chat_id",
                String.valueOf(message.chatId())));
        reply = MSG_UNAVAILABLE;
      }
      audit.outbound(message.channel(), message.chatId(), reply);
      return reply;
    } finally {
      MDC.remove("traceId");
    }
  }

  private String handleLocked(InboundMessage message, String traceId) {
    Optional<String> token = chatLock.tryLock(message.channel(), message.chatId());
    if (token.isEmpty()) {
      return MSG_BUSY;
    }
    try {
      return handle(message, traceId);
    } finally {
      chatLock.unlock(message.channel(), message.chatId(), token.get());
    }
  }

  private String handle(InboundMessage message, String traceId) {
    Session session = sessions.getOrCreate(traceId, message.channel(), message.chatId());
    String text = message.text() == null ? "" : message.text().trim();

    if (debugCommands && text.startsWith("/debug")) {
      return debugInfo(session);
    }

    List<ChatTurn> history = session.getSlots().recentHistory();
    String reply;
    try {
      reply = dispatch(session, text, history);
    } catch (BudgetExceededException e) {
      log.warn("Message not processed, budget exceeded: {}", e.getReason());
      reply = budgetReply();
    } catch (GenerationException e) {
      log.warn("Message not processed, generation failed: {}", e.getMessage());
      audit.error("generation", e.getMessage(), Map.of("state", session.getState().name()));
      reply = MSG_GENERATION_FAILED;
    }

    session.getSlots().addTurn(ChatTurn.user(text));
    session.getSlots().addTurn(ChatTurn.assistant(reply));
    sessions.save(session);
    return reply;
  }

  private String dispatch(Session session, String text, List<ChatTurn> history) {
    switch (session.getState()) {
      case IDLE:
        return handleIdle(session, text, history);
      case BOOKING_IN_PROGRESS:
        return MSG_IN_PROGRESS;
      case HANDOFF_TO_ADMIN:
      case ADMIN_RESPONDING:
        adminNotifier.notifyAdmin(
            "Сообщение от клиента " + session.getChannel() + ":" + session.getChatId() + "\n\n"
                + text);
        return MSG_FORWARDED;
      case BOOKING_DONE:
        // next booking starts from scratch but the client is already known
        session.getSlots().clearForNextBooking();
        sessions.transition(session, ConversationState.IDLE);
        return handleIdle(session, text, history);
      case CANCEL_FLOW:
        sessions.transition(session, ConversationState.IDLE);
        return handleIdle(session, text, history);
      default:
        return handleCollecting(session, text, history);
    }
  }

  private String handleIdle(Session session, String text, List<ChatTurn> history) {
    IntentResult r = extractor.resolve(text, session.getState(), session.getSlots(), history);
    switch (r.intent()) {
      case BOOKING:
        if (!sessions.transition(session, ConversationState.COLLECTING_INTENT)) {
          return orDefault(r.responseText(), MSG_START_BOOKING);
        }
        String notice = mergeSlots(session, r.slots());
        return advance(session, r.responseText(), notice, MSG_START_BOOKING);
      case SCHEDULE_QUERY:
        // browsing is only reachable through intent collection
        if (sessions.transition(session, ConversationState.COLLECTING_INTENT)) {
          sessions.transition(session, ConversationState.BROWSING_SCHEDULE);
        }
        return scheduleListing(r);
      case CANCEL:
        return cancel(session);
      case ADMIN:
        return handoff(session, text);
      default:
        return orDefault(r.responseText(), MSG_HOW_CAN_I_HELP);
    }
  }

  private String handleCollecting(Session session, String text, List<ChatTurn> history) {
    IntentResult r = extractor.resolve(text, session.getState(), session.getSlots(), history);
    if (r.intent() == Intent.CANCEL) {
      return cancel(session);
    }
    if (r.intent() == Intent.ADMIN) {
      return handoff(session, text);
    }

    String notice = mergeSlots(session, r.slots());

    if (session.getState() == ConversationState.CONFIRM_BOOKING) {
      String answer = normalizeAnswer(text);
      if (AFFIRMATIVE.contains(answer)) {
        return confirmBooking(session);
      }
      if (NEGATIVE.contains(answer)) {
        sessions.transition(session, ConversationState.IDLE);
        return MSG_CANCELLED;
      }
      if (session.getSlots().hasAllRequired()) {
        return orDefault(r.responseText(), receipts.summary(session.getSlots()));
      }
    }

    if (r.intent() == Intent.SCHEDULE_QUERY && !session.getSlots().hasAllRequired()) {
      return scheduleListing(r);
    }
    return advance(session, r.responseText(), notice, MSG_HOW_CAN_I_HELP);
  }

  /**
   * Moves to confirmation once every slot is known, otherwise towards the state that collects the
   * first missing slot. Passing through intermediate slot states is allowed; going back is not.
   */
  private String advance(Session session, String responseText, String notice, String fallback) {
    SlotValues slots = session.getSlots();
    List<Slot> missing = slots.missing();
    if (missing.isEmpty()) {
      if (walkTo(session, ConversationState.CONFIRM_BOOKING)) {
        return receipts.summary(slots);
      }
      log.warn("No path from {} to confirmation", session.getState());
      return orDefault(responseText, fallback);
    }

    walkTo(session, collectingStateFor(missing.get(0)));
    if (notice != null) {
      return notice;
    }
    String prompt =
        MSG_NEED_INFO + missing.stream().map(Slot::label).collect(Collectors.joining(", "));
    return orDefault(responseText, prompt);
  }

  private boolean walkTo(Session session, ConversationState target) {
    if (session.getState() == target) {
      return true;
    }
    List<ConversationState> path = fsm.pathTo(session.getState(), target);
    if (path.isEmpty()) {
      return false;
    }
    for (ConversationState step : path) {
      if (!sessions.transition(session, step)) {
        return false;
      }
    }
    return true;
  }

  private static ConversationState collectingStateFor(Slot slot) {
    switch (slot) {
      case GROUP:
        return ConversationState.COLLECTING_GROUP;
      case DATETIME:
        return ConversationState.COLLECTING_DATETIME;
      default:
        return ConversationState.COLLECTING_CONTACT;
    }
  }

  /**
   * Copies extracted values into the session. The resolved datetime only ever comes from the
   * temporal resolver.
   *
   * @return a message for the user when the datetime expression was rejected, else null
   */
  private String mergeSlots(Session session, ExtractedSlots extracted) {
    SlotValues slots = session.getSlots();
    if (notBlank(extracted.group()) && !extracted.group().equals(slots.getGroup())) {
      slots.setGroup(extracted.group());
      slots.setScheduleId(null);
    }
    if (notBlank(extracted.clientName())) {
      slots.setClientName(extracted.clientName());
    }
    if (notBlank(extracted.clientPhone())) {
      slots.setClientPhone(extracted.clientPhone());
    }
    if (notBlank(extracted.datetime())) {
      slots.setDatetimeRaw(extracted.datetime());
      TemporalResult t = temporal.parse(extracted.datetime(), now());
      Optional<ZonedDateTime> resolved =
          t.toDateTime(studio.timezone(), studio.defaultClassTime());
      if (resolved.isPresent()) {
        slots.setDatetimeResolved(resolved.get().toOffsetDateTime());
        slots.setScheduleId(null);
      } else {
        log.info("Datetime not resolved from '{}': {}", extracted.datetime(), t.error());
        slots.setDatetimeResolved(null);
        return t.error();
      }
    }
    return null;
  }

  private String confirmBooking(Session session) {
    SlotValues slots = session.getSlots();
    if (!slots.hasAllRequired()) {
      return MSG_INCOMPLETE;
    }
    sessions.transition(session, ConversationState.BOOKING_IN_PROGRESS);
    sessions.save(session);

    Long scheduleId = slots.getScheduleId();
    try {
      CrmResult<Optional<Client>> found = crm.findClient(slots.getClientPhone());
      if (!found.isOk()) {
        return abort(session, found.failure(), null);
      }
      Client client = found.value().orElse(null);
      if (client == null) {
        CrmResult<Client> created = crm.createClient(slots.getClientName(), slots.getClientPhone());
        if (!created.isOk()) {
          return abort(session, created.failure(), null);
        }
        client = created.value();
      }

      if (scheduleId == null) {
        CrmResult<Optional<Long>> match = findSchedule(slots);
        if (!match.isOk()) {
          return abort(session, match.failure(), null);
        }
        if (match.value().isEmpty()) {
          sessions.transition(session, ConversationState.IDLE);
          audit.bookingAttempt("no_schedule_match", bookingDetails(slots, null, null));
          return MSG_NO_MATCH;
        }
        scheduleId = match.value().get();
        slots.setScheduleId(scheduleId);
      }

      String lockKey = String.valueOf(scheduleId);
      LockResult lock = idempotency.acquire(slots.getClientPhone(), lockKey);
      if (!lock.isNew()) {
        sessions.transition(session, ConversationState.IDLE);
        audit.bookingAttempt("duplicate", bookingDetails(slots, scheduleId, null));
        return lock.message();
      }

      CrmResult<Reservation> booked;
      try {
        booked = crm.createBooking(client.id(), scheduleId);
      } catch (RuntimeException e) {
        idempotency.release(slots.getClientPhone(), lockKey);
        throw e;
      }
      if (!booked.isOk()) {
        idempotency.release(slots.getClientPhone(), lockKey);
        return abort(session, booked.failure(), scheduleId);
      }

      Reservation reservation = booked.value();
      sessions.transition(session, ConversationState.BOOKING_DONE);
      audit.bookingAttempt("success", bookingDetails(slots, scheduleId, null));
      log.info("Booking created: reservation={} schedule={}", reservation.id(), scheduleId);
      return receipts.receipt(
          slots,
          orDefault(client.name(), slots.getClientName()),
          orDefault(client.phone(), slots.getClientPhone()),
          reservation.id());
    } catch (RuntimeException e) {
      log.error("Booking failed unexpectedly", e);
      sessions.transition(session, ConversationState.IDLE);
      audit.bookingAttempt("failed", bookingDetails(slots, scheduleId, e.getMessage()));
      return MSG_BOOKING_FAILED;
    }
  }

  private String abort(Session session, CrmFailure failure, Long scheduleId) {
    sessions.transition(session, ConversationState.IDLE);
    audit.bookingAttempt(
        "failed", bookingDetails(session.getSlots(), scheduleId, failure.kind().name()));
    return failure.userMessage();
  }

  /** First entry on the exact date and time, of the named group when the name is known. */
  private CrmResult<Optional<Long>> findSchedule(SlotValues slots) {
    ZonedDateTime at = slots.getDatetimeResolved().atZoneSameInstant(studio.timezone());
    String date = at.toLocalDate().toString();
    String time = at.toLocalTime().format(DateTimeFormatter.ofPattern("HH:mm"));

    Long groupId = null;
    if (notBlank(slots.getGroup())) {
      CrmResult<List<Group>> groups = crm.getGroups();
      if (!groups.isOk()) {
        return CrmResult.failed(groups.failure());
      }
      String wanted = slots.getGroup().trim().toLowerCase(Locale.ROOT);
      for (Group g : groups.value()) {
        if (g.name() != null && g.name().trim().toLowerCase(Locale.ROOT).equals(wanted)) {
          groupId = g.id();
          break;
        }
      }
    }

    CrmResult<List<ScheduleEntry>> schedule = crm.getSchedule(at.toLocalDate(), null, null);
    if (!schedule.isOk()) {
      return CrmResult.failed(schedule.failure());
    }
    for (ScheduleEntry e : schedule.value()) {
      if (date.equals(e.date())
          && time.equals(e.hourMinute())
          && (groupId == null || groupId.equals(e.groupId()))) {
        return CrmResult.ok(Optional.of(e.id()));
      }
    }
    return CrmResult.ok(Optional.empty());
  }

  private String scheduleListing(IntentResult r) {
    LocalDate from = now().toLocalDate();
    if (notBlank(r.slots().datetime())) {
      TemporalResult t = temporal.parse(r.slots().datetime(), now());
      if (t.isResolved()) {
        from = t.date();
      }
    }
    CrmResult<List<ScheduleEntry>> schedule =
        crm.getSchedule(from, from.plusDays(SCHEDULE_LISTING_DAYS), null);
    if (!schedule.isOk()) {
      return schedule.failure().userMessage();
    }
    Map<Long, String> groupNames = new HashMap<>();
    CrmResult<List<Group>> groups = crm.getGroups();
    if (groups.isOk()) {
      for (Group g : groups.value()) {
        groupNames.put(g.id(), g.name());
      }
    }

    List<String> lines =
        schedule.value().stream()
            .filter(e -> !Boolean.FALSE.equals(e.active()))
            .filter(BookingOrchestrator::hasSeats)
            .sorted(
                (a, b) ->
                    (a.date() + " " + a.hourMinute()).compareTo(b.date() + " " + b.hourMinute()))
            .limit(SCHEDULE_LISTING_MAX)
            .map(e -> listingLine(e, groupNames))
            .collect(Collectors.toList());
    if (lines.isEmpty()) {
      return orDefault(r.responseText(), MSG_NO_CLASSES);
    }
    return "Ближайшие занятия:\n" + String.join("\n", lines) + "\n\nНа какое записать?";
  }

  private static boolean hasSeats(ScheduleEntry e) {
    return e.maxStudents() == null
        || e.currentStudents() == null
        || e.currentStudents() < e.maxStudents();
  }

  private static String listingLine(ScheduleEntry e, Map<Long, String> groupNames) {
    String day = e.date();
    try {
      day = LocalDate.parse(e.date()).format(LISTING_FORMAT);
    } catch (RuntimeException ex) {
      // keep the CRM's own text
    }
    String name = e.groupId() == null ? null : groupNames.get(e.groupId());
    return day + " " + e.hourMinute() + (name == null ? "" : " " + name);
  }

  private String cancel(Session session) {
    sessions.transition(session, ConversationState.CANCEL_FLOW);
    sessions.transition(session, ConversationState.IDLE);
    session.getSlots().clearForNextBooking();
    return MSG_CANCELLED;
  }

  private String handoff(Session session, String text) {
    if (!sessions.transition(session, ConversationState.HANDOFF_TO_ADMIN)) {
      return MSG_HOW_CAN_I_HELP;
    }
    SlotValues slots = session.getSlots();
    adminNotifier.notifyAdmin(
        "Клиент просит администратора\n\nЧат: "
            + session.getChannel()
            + ":"
            + session.getChatId()
            + "\nИмя: "
            + orDefault(slots.getClientName(), "-")
            + "\nТелефон: "
            + orDefault(slots.getClientPhone(), "-")
            + "\n\n"
            + text);
    return MSG_HANDOFF;
  }

  private String debugInfo(Session session) {
    SlotValues s = session.getSlots();
    return "Debug info:\nState: "
        + session.getState()
        + "\nSlots: group="
        + s.getGroup()
        + ", datetime="
        + receipts.dateTime(s)
        + ", name="
        + s.getClientName()
        + ", phone="
        + s.getClientPhone()
        + ", scheduleId="
        + s.getScheduleId()
        + "\nTrace ID: "
        + session.getTraceId()
        + "\nCreated: "
        + session.getCreatedAt()
        + "\nUpdated: "
        + session.getUpdatedAt();
  }

  private Map<String, Object> bookingDetails(SlotValues slots, Long scheduleId, String error) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("group", slots.getGroup());
    m.put("datetime", slots.getDatetimeResolved() == null ? null : receipts.dateTime(slots));
    m.put("client_name", slots.getClientName());
    m.put("client_phone", slots.getClientPhone());
    m.put("schedule_id", scheduleId);
    if (error != null) {
      m.put("error", error);
    }
    return m;
  }

  private String budgetReply() {
    String phone = studio.phone();
    return phone == null || phone.isBlank() ? MSG_BUDGET + "." : MSG_BUDGET + ": " + phone;
  }

  private ZonedDateTime now() {
    return ZonedDateTime.now(clock.withZone(studio.timezone()));
  }

  static String normalizeAnswer(String text) {
    return text.toLowerCase(Locale.ROOT).replaceAll("[\\s.!,)]+$", "").trim();
  }

  private static boolean notBlank(String s) {
    return s != null && !s.isBlank();
  }

  private static String orDefault(String s, String fallback) {
    return notBlank(s) ? s : fallback;
  }
}
