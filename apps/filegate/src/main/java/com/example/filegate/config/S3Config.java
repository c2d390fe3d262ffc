package com.example.filegate.config;

import com.example.filegate.config.properties.FileGateProperties;
import com.example.filegate.config.properties.FileGateProperties.S3ClientProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.nio.netty.NettyNioAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3AsyncClientBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * Async S3 client shared by all S3 storages. Only created when {@code file-gate.s3.enabled=true}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "file-gate.s3.enabled", havingValue = "true")
public class S3Config {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration STREAM_TIMEOUT = Duration.ofSeconds(60);

    @Bean(destroyMethod = "close")
    public S3AsyncClient s3AsyncClient(FileGateProperties properties) {
        S3ClientProperties s3 = properties.s3();

        S3AsyncClientBuilder builder = S3AsyncClient.builder()
                .region(Region.of(s3.region()))
                .credentialsProvider(credentialsProvider(s3))
                .httpClientBuilder(NettyNioAsyncHttpClient.builder()
                        .connectionTimeout(CONNECT_TIMEOUT)
                        .readTimeout(STREAM_TIMEOUT));

        if (StringUtils.hasText(s3.endpoint())) {
            // MinIO and LocalStack need path-style addressing
            builder.endpointOverride(URI.create(s3.endpoint()))
                    .forcePathStyle(true);
        }

        log.info("S3 client configured: region={}, endpoint={}", s3.region(),
                StringUtils.hasText(s3.endpoint()) ? s3.endpoint() : "aws");
        return builder.build();
    }

    private AwsCredentialsProvider credentialsProvider(S3ClientProperties s3) {
        if (StringUtils.hasText(s3.accessKeyId()) && StringUtils.hasText(s3.secretAccessKey())) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(s3.accessKeyId(), s3.secretAccessKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
