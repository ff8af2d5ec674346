package com.keystone;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class KeystoneApplication {

    public static void main(String[] args) {
        // Library-style core: no web server, the context hosts the orchestration services.
        new SpringApplicationBuilder(KeystoneApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
