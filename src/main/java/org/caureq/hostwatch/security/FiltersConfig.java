package org.caureq.hostwatch.security;

import org.caureq.hostwatch.config.AdminProps;
import org.caureq.hostwatch.config.AppProps;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FiltersConfig {

    @Bean
    public FilterRegistrationBean<ApiKeyFilter> ingestFilterRegistration(AppProps props) {
        var reg = new FilterRegistrationBean<>(new ApiKeyFilter(props));
        reg.setOrder(5);
        reg.addUrlPatterns("/api/ingest", "/api/ingest/*");
        return reg;
    }

    @Bean
    public FilterRegistrationBean<ApiKeyAdminFilter> adminFilterRegistration(AdminProps props) {
        var reg = new FilterRegistrationBean<>(new ApiKeyAdminFilter(props));
        reg.setOrder(10);
        reg.addUrlPatterns("/api/admin/*");
        return reg;
    }
}
