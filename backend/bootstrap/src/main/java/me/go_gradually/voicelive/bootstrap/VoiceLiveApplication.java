package me.go_gradually.voicelive.bootstrap;

import me.go_gradually.voicelive.infrastructure.shared.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = "me.go_gradually.voicelive")
@EnableConfigurationProperties(AppProperties.class)
public class VoiceLiveApplication {
    public static void main(String[] args) {
        SpringApplication.run(VoiceLiveApplication.class, args);
    }
}
