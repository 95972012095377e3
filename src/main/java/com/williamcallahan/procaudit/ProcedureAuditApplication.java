package com.williamcallahan.procaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ProcedureAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProcedureAuditApplication.class, args);
    }

}
