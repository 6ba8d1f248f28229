package me.go_gradually.ceddy.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "me.go_gradually.ceddy")
public class CeddyApplication {
    public static void main(String[] args) {
        SpringApplication.run(CeddyApplication.class, args);
    }
}
