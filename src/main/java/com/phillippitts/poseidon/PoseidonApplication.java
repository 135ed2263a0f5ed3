package com.phillippitts.poseidon;

import com.phillippitts.poseidon.config.backend.DirectApiConfig;
import com.phillippitts.poseidon.config.backend.OcrConfig;
import com.phillippitts.poseidon.config.backend.VisionModelConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        VisionModelConfig.class,
        OcrConfig.class,
        DirectApiConfig.class,
        com.phillippitts.poseidon.config.properties.PlausibilityProperties.class,
        com.phillippitts.poseidon.config.properties.ReconciliationProperties.class,
        com.phillippitts.poseidon.config.properties.SessionProperties.class,
        com.phillippitts.poseidon.config.properties.ConversationProperties.class,
        com.phillippitts.poseidon.config.properties.SpotProperties.class
})
public class PoseidonApplication {

    public static void main(String[] args) {
        SpringApplication.run(PoseidonApplication.class, args);
    }

}
