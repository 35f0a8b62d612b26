package com.jobly.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.filter.CommonsRequestLoggingFilter;

@Configuration
public class JoblyConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        // request bodies with fields outside the schema are rejected
        mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /** One DEBUG line per request; enabled by the logger level of this filter class. */
    @Bean
    public CommonsRequestLoggingFilter requestLoggingFilter() {
        CommonsRequestLoggingFilter filter = new CommonsRequestLoggingFilter();
        filter.setIncludeQueryString(true);
        filter.setIncludeClientInfo(false);
        filter.setIncludePayload(false);
        filter.setIncludeHeaders(false);
        return filter;
    }

    @Bean
    public PasswordEncoder passwordEncoder(JoblyProperties properties) {
        return new BCryptPasswordEncoder(properties.getAuth().getBcryptWorkFactor());
    }
}
