package com.sc360.reportrefresh;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class ReportRefreshApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(ReportRefreshApplication.class, args);
        if (context.getEnvironment().getProperty("report-refresh.scheduling.one-shot", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
