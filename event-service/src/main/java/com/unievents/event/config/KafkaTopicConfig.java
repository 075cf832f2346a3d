package com.unievents.event.config;

import com.unievents.common.util.Constants;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaTopicConfig {

    @Value("${events.kafka.partitions:3}")
    private int partitions;

    @Value("${events.kafka.replicas:1}")
    private int replicas;

    @Bean
    public NewTopic registrationCreatedTopic() {
        return TopicBuilder.name(Constants.TOPIC_REGISTRATION_CREATED).partitions(partitions).replicas(replicas).build();
    }

    @Bean
    public NewTopic refundRequestedTopic() {
        return TopicBuilder.name(Constants.TOPIC_REFUND_REQUESTED).partitions(partitions).replicas(replicas).build();
    }

    @Bean
    public NewTopic eventStatusChangedTopic() {
        return TopicBuilder.name(Constants.TOPIC_EVENT_STATUS_CHANGED).partitions(partitions).replicas(replicas).build();
    }
}
