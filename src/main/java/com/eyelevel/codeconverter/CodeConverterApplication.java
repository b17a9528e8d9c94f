package com.eyelevel.codeconverter;

import com.eyelevel.codeconverter.config.ConversionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;

/**
 * The main entry point for the Code Converter Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link SpringBootApplication}: auto-configuration, component scanning and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: binds the "app.conversion" properties to
 *     {@link ConversionProperties}.</li>
 *     <li>{@link EnableRetry}: activates the retry advice around the temporary token fetch.</li>
 * </ul>
 * No web server is started; hosts drive conversions through
 * {@link com.eyelevel.codeconverter.service.ConversionService}.
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(value = ConversionProperties.class)
@EnableRetry
public class CodeConverterApplication {

    /**
     * Launches the application and logs key environment information upon startup.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("🚀 Starting CodeConverterApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(CodeConverterApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "CodeConverter"));
        log.info("  - Table API:  {}", env.getProperty("app.table-client.baseurl"));
        log.info("  - Upload queue: concurrency {}, interval {} ms",
                 env.getProperty("app.conversion.queue.max-concurrency", "3"),
                 env.getProperty("app.conversion.queue.request-interval-ms", "150"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
