package com.phillippitts.vadbridge;

import com.phillippitts.vadbridge.config.VadBridgeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(VadBridgeProperties.class)
public class VadBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(VadBridgeApplication.class, args);
    }

}
