package com.example.projectservice.event;

import com.example.common.events.UserDeletedEvent;
import com.example.projectservice.config.KafkaConsumerConfig;
import com.example.projectservice.repository.ProjectRepository;
import com.example.projectservice.repository.StoreCallHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Clears weak references to a deleted user.
 *
 * Projects advised by the user lose their advisor; nothing is deleted. Team member rows
 * pointing at the user stay and are skipped when projects are hydrated.
 * Idempotent: replaying the event updates zero rows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true")
public class UserDeletedEventConsumer {

    private final ProjectRepository projectRepository;
    private final StoreCallHandler storeCallHandler;

    @KafkaListener(
            topics = "${project.kafka.user-deleted-topic:user.deleted}",
            containerFactory = KafkaConsumerConfig.USER_DELETED_CONTAINER_FACTORY
    )
    public void handleUserDeletedEvent(UserDeletedEvent event) {
        if (event == null || event.getUserId() == null) {
            log.warn("Ignoring UserDeletedEvent without userId: {}", event);
            return;
        }

        log.info("Received UserDeletedEvent: userId={}, eventId={}", event.getUserId(), event.getEventId());

        // PersistenceException propagates so the container retries
        int cleared = storeCallHandler.handleStoreCall(
                () -> projectRepository.clearAdvisorReferences(event.getUserId()),
                "clearAdvisorReferences");

        log.info("Cleared advisor reference on {} project(s) for deleted user {}", cleared, event.getUserId());
    }
}
