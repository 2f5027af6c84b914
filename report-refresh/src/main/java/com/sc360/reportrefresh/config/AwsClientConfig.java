package com.sc360.reportrefresh.config;

import com.amazonaws.services.redshiftdataapi.AWSRedshiftDataAPI;
import com.amazonaws.services.redshiftdataapi.AWSRedshiftDataAPIClientBuilder;
import com.amazonaws.services.sns.AmazonSNS;
import com.amazonaws.services.sns.AmazonSNSClientBuilder;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * AWS clients use the default credential chain (IAM role, env vars or ~/.aws/credentials).
 */
@Configuration
@RequiredArgsConstructor
public class AwsClientConfig {

    private final ReportRefreshProperties properties;

    @Bean(destroyMethod = "shutdown")
    public AWSRedshiftDataAPI redshiftDataClient() {
        return AWSRedshiftDataAPIClientBuilder.standard()
                .withRegion(properties.getAwsRegion())
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public AmazonSNS snsClient() {
        return AmazonSNSClientBuilder.standard()
                .withRegion(properties.getAwsRegion())
                .build();
    }
}
