package com.chainpulse.analytics;

import com.chainpulse.analytics.config.AnalyticsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = {"com.chainpulse.analytics", "com.chainpulse.common"})
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsServiceApplication {
	
	public static void main(String[] args) {
		SpringApplication.run(AnalyticsServiceApplication.class, args);
	}
}
