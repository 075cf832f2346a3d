package com.unievents.event.job;

import com.unievents.event.domain.model.Event;
import com.unievents.event.domain.model.EventStatus;
import com.unievents.event.domain.repository.EventRepository;
import com.unievents.event.domain.service.EventLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Moves PUBLISHED events whose end date has passed to COMPLETED, as the system actor.
 * Each event is completed in its own transaction; one failure does not stop the rest.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventCompletionJob {

    private final EventRepository eventRepository;
    private final EventLifecycleService eventLifecycleService;
    private final Clock clock;

    @Value("${events.completion.enabled:true}")
    private boolean completionEnabled;

    @Scheduled(fixedDelayString = "${events.completion.interval-ms:60000}")
    public void completeEndedEvents() {
        if (!completionEnabled) return;
        List<Event> ended = eventRepository.findByStatusAndArchivedFalseAndEndDateBefore(
                EventStatus.PUBLISHED, clock.instant());
        if (ended.isEmpty()) return;
        log.info("Completion job: found {} ended event(s)", ended.size());
        int completed = 0;
        for (Event event : ended) {
            try {
                if (eventLifecycleService.completeEndedEvent(event.getId())) {
                    completed++;
                }
            } catch (Exception e) {
                log.error("Completing event {} failed, will retry next run", event.getId(), e);
            }
        }
        log.info("Completion job: {} event(s) moved to COMPLETED", completed);
    }
}
