package com.agentgate;

import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentGateApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(AgentGateApplication.class)
                .properties("spring.main.banner-mode=off")
                .run(args);
    }
}
