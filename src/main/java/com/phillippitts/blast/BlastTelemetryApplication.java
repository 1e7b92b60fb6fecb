package com.phillippitts.blast;

import com.phillippitts.blast.config.properties.LogRouterProperties;
import com.phillippitts.blast.config.properties.PerformanceProperties;
import com.phillippitts.blast.config.properties.RecoveryProperties;
import com.phillippitts.blast.config.properties.SerialLoggerProperties;
import com.phillippitts.blast.config.properties.WatchdogProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        LogRouterProperties.class,
        PerformanceProperties.class,
        SerialLoggerProperties.class,
        WatchdogProperties.class,
        RecoveryProperties.class
})
@EnableScheduling
public class BlastTelemetryApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlastTelemetryApplication.class, args);
    }
}
