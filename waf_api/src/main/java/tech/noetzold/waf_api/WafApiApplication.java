package tech.noetzold.waf_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WafApiApplication {
    public static void main(String[] args) {
        SpringApplication.run(WafApiApplication.class, args);
    }
}
