package com.clapgrow.tempmail.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.web.reactive.WebFluxAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(exclude = {
    WebFluxAutoConfiguration.class  // MVC server; WebClient is only used for outbound calls
})
@ConfigurationPropertiesScan
public class TempMailGatewayApplication {
    public static void main(String[] args) {
        SpringApplication.run(TempMailGatewayApplication.class, args);
    }
}
