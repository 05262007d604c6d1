package io.agentmind;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AgentMind: a conversational agent with short-term and long-term memory, powered by Spring AI.
 */
@SpringBootApplication
public class AgentMindApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentMindApplication.class, args);
    }
}
