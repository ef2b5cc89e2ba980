package com.cred.freestyle.groupbuy.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.util.Map;

/**
 * Ships the group-buy business metrics (groupbuy.*) and HTTP request timings to AWS CloudWatch.
 * Everything else the Actuator binds (JVM, pools, Hikari) is dropped.
 * Only active with cloud.aws.cloudwatch.enabled=true; otherwise the Actuator default registry is used.
 *
 * @author Group Buy Team
 */
@Configuration
@ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true")
public class CloudWatchConfig {

    static final String GROUP_BUY_METRICS = "groupbuy.";
    static final String HTTP_METRICS = "http.server.requests";

    private final String awsRegion;
    private final String applicationName;
    private final Map<String, String> registrySettings;

    public CloudWatchConfig(
            @Value("${cloud.aws.region:ap-south-1}") String awsRegion,
            @Value("${spring.application.name:group-buy}") String applicationName,
            @Value("${cloud.aws.cloudwatch.namespace:GroupBuy}") String namespace,
            @Value("${cloud.aws.cloudwatch.batch-size:20}") int batchSize,
            @Value("${cloud.aws.cloudwatch.step:PT1M}") String step
    ) {
        this.awsRegion = awsRegion;
        this.applicationName = applicationName;
        // Keys as read by the defaults of io.micrometer.cloudwatch2.CloudWatchConfig
        this.registrySettings = Map.of(
                "cloudwatch.namespace", namespace,
                "cloudwatch.batchSize", String.valueOf(batchSize),
                "cloudwatch.step", step
        );
    }

    @Bean
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    @Bean
    public MeterRegistry meterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        io.micrometer.cloudwatch2.CloudWatchConfig settings = registrySettings::get;
        CloudWatchMeterRegistry registry = new CloudWatchMeterRegistry(settings, Clock.SYSTEM, cloudWatchAsyncClient);

        registry.config()
                .commonTags("application", applicationName, "region", awsRegion)
                .meterFilter(MeterFilter.acceptNameStartsWith(GROUP_BUY_METRICS))
                .meterFilter(MeterFilter.acceptNameStartsWith(HTTP_METRICS))
                .meterFilter(MeterFilter.deny());
        return registry;
    }
}
