package com.metricore.service.core.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Import;

/** Registers the metrics engine components in a host application context. */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(MetricoreProperties.class)
@Import({ClockConfig.class, JacksonConfig.class})
@ComponentScan(
        basePackages = {
            "com.metricore.service.core.catalog",
            "com.metricore.service.core.store",
            "com.metricore.service.core.aggregate",
            "com.metricore.service.core.group",
            "com.metricore.service.core.expression",
            "com.metricore.service.core.filter",
            "com.metricore.service.core.query",
            "com.metricore.service.core.api"
        })
public class MetricoreAutoConfiguration {}
