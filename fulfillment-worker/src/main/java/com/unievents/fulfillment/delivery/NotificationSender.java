package com.unievents.fulfillment.delivery;

import com.unievents.fulfillment.client.dto.CompletedEvent;
import com.unievents.fulfillment.client.dto.DueReminder;
import com.unievents.fulfillment.client.dto.EligibleRegistration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Delivers reminders and certificates.
 * Mock implementation: logs the delivery instead of calling a mail provider or rendering a PDF.
 */
@Slf4j
@Service
public class NotificationSender {

    public void sendReminder(DueReminder reminder, Duration lead) {
        log.info("Reminder sent: user={} event='{}' startsAt={} lead={}h registration={}",
                reminder.userId(), reminder.eventName(), reminder.startsAt(), lead.toHours(),
                reminder.registrationId());
    }

    public void sendCertificate(EligibleRegistration registration, CompletedEvent event) {
        log.info("Certificate of attendance sent: user={} event='{}' registration={}",
                registration.userId(), event.name(), registration.id());
    }
}
