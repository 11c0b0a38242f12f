package dev.contentscanner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
@RequiredArgsConstructor
public class ContentScannerApplication implements CommandLineRunner {

    private static final String SEPARATOR = "========================================";

    private final QueueConsumerRunner queueConsumerRunner;

    public static void main(String[] args) {
        SpringApplication.run(ContentScannerApplication.class, args);
    }

    @Override
    public void run(String... args) {
        log.info(SEPARATOR);
        log.info("Content Scanner Starting");
        log.info(SEPARATOR);

        queueConsumerRunner.start();
    }
}
