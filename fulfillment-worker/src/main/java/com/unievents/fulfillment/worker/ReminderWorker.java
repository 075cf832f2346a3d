package com.unievents.fulfillment.worker;

import com.unievents.common.dto.BaseResponse;
import com.unievents.fulfillment.client.EventCoreClient;
import com.unievents.fulfillment.client.dto.DueReminder;
import com.unievents.fulfillment.delivery.DeliveryLedger;
import com.unievents.fulfillment.delivery.NotificationSender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Sends "your event starts soon" reminders at each configured lead time (24h and 1h by default).
 *
 * Each tick asks the core for registrations of events starting within lead + poll interval and
 * keeps those that start no earlier than lead - poll interval, so a late or skipped tick still
 * catches every event. The ledger makes the overlap harmless.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReminderWorker {

    private final EventCoreClient eventCoreClient;
    private final DeliveryLedger deliveryLedger;
    private final NotificationSender notificationSender;
    private final Clock clock;

    @Value("${fulfillment.reminders.enabled:true}")
    private boolean enabled = true;

    @Value("${fulfillment.reminders.lead-minutes:1440,60}")
    private List<Long> leadMinutes = List.of(1440L, 60L);

    @Value("${fulfillment.reminders.interval-ms:900000}")
    private long intervalMs = 900_000L;

    @Scheduled(fixedDelayString = "${fulfillment.reminders.interval-ms:900000}")
    public void dispatchReminders() {
        if (!enabled) return;
        Duration tolerance = Duration.ofMillis(intervalMs);
        for (Long minutes : leadMinutes) {
            Duration lead = Duration.ofMinutes(minutes);
            try {
                dispatch(lead, tolerance);
            } catch (Exception e) {
                log.error("Reminder poll for lead {}min failed; retrying next tick", minutes, e);
            }
        }
    }

    private void dispatch(Duration lead, Duration tolerance) {
        Instant earliestStart = clock.instant().plus(lead).minus(tolerance);
        long windowMinutes = lead.plus(tolerance).toMinutes();
        BaseResponse<List<DueReminder>> response = eventCoreClient.getDueReminders(windowMinutes);
        List<DueReminder> due = response.getData() == null ? List.of() : response.getData();

        int sent = 0;
        for (DueReminder reminder : due) {
            if (reminder.startsAt().isBefore(earliestStart)) continue;
            if (deliver(reminder, lead)) sent++;
        }
        if (sent > 0) {
            log.info("Reminder tick (lead {}min): {} sent, {} candidate(s)", lead.toMinutes(), sent, due.size());
        }
    }

    private boolean deliver(DueReminder reminder, Duration lead) {
        String key = DeliveryLedger.reminderKey(reminder.registrationId(), lead);
        if (!deliveryLedger.claim(key)) {
            return false;
        }
        try {
            notificationSender.sendReminder(reminder, lead);
            return true;
        } catch (Exception e) {
            log.error("Reminder for registration {} failed", reminder.registrationId(), e);
            deliveryLedger.release(key);
            return false;
        }
    }
}
