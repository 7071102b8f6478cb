package com.foo.tariff;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PortTariffApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortTariffApplication.class, args);
    }
}
