package com.netaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NetAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetAuditApplication.class, args);
    }
}
