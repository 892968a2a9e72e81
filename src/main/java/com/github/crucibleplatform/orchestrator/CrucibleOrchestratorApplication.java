package com.github.crucibleplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@SpringBootApplication
@EnableTransactionManagement
public class CrucibleOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrucibleOrchestratorApplication.class);
    }

}
