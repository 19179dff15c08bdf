package com.conversio.service.core.config;

import com.conversio.service.core.funnel.breakdown.CohortMembership;
import com.conversio.service.core.funnel.match.ActionLookup;
import java.time.Clock;
import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@Configuration
public class FunnelEngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionLookup actionLookup() {
        return ActionLookup.none();
    }

    @Bean
    @ConditionalOnMissingBean
    public CohortMembership cohortMembership() {
        return CohortMembership.none();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock systemUtcClock() {
        return Clock.systemUTC();
    }
}
