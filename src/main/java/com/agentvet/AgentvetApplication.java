package com.agentvet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class AgentvetApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(AgentvetApplication.class, args);
        // One-shot audit runs exit with the verdict instead of serving requests
        if (context.getEnvironment().getProperty("agentvet.audit.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
