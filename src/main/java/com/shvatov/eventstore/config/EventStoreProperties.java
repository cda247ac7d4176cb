package com.shvatov.eventstore.config;

import com.shvatov.eventstore.model.EventStoreColumn;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "event-store")
public class EventStoreProperties {
    private boolean enabled = true;
    private String tableName = EventStoreColumn.DEFAULT_TABLE_NAME;

    // null or negative waits until the lock is granted
    private Duration lockTimeout;

    private boolean createDispatchIndex = true;
}
