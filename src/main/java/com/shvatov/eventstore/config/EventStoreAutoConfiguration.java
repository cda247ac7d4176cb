package com.shvatov.eventstore.config;

import com.shvatov.eventstore.service.session.EventStoreSession;
import com.shvatov.eventstore.service.session.EventStoreSessionFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@EnableConfigurationProperties(EventStoreProperties.class)
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "event-store", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EventStoreAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public EventStoreSessionFactory eventStoreSessionFactory(final DataSource dataSource,
                                                             final EventStoreProperties properties) {
        return new EventStoreSessionFactory(dataSource, properties);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public EventStoreSession eventStoreSession(final EventStoreSessionFactory eventStoreSessionFactory) {
        return eventStoreSessionFactory.open();
    }
}
