package io.volunteerhub.emails.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(EmailsProperties.class)
public class PropertiesConfig {}
