package com.jobly.config;

import com.jobly.board.auth.CapabilityInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {
    private final CapabilityInterceptor capabilityInterceptor;

    public WebConfig(CapabilityInterceptor capabilityInterceptor) {
        this.capabilityInterceptor = capabilityInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(capabilityInterceptor);
    }
}
