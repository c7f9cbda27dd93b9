package com.cfgval.service;

import com.cfgval.service.source.GrammarSource;
import com.cfgval.service.source.HttpGrammarSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration(proxyBeanMethods = false)
class ValidatorConfiguration implements WebMvcConfigurer {

    private final ValidatorProperties properties;

    ValidatorConfiguration(ValidatorProperties properties) {
        this.properties = properties;
    }

    @Bean
    GrammarSource grammarSource() {
        ValidatorProperties.Source source = properties.grammarSource();
        return HttpGrammarSource.create(
                source.baseUrl(), source.connectTimeout(), source.requestTimeout());
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(properties.cors().allowedOrigins().toArray(String[]::new))
                .allowedHeaders("*")
                .allowedMethods("*");
    }
}
