package com.rekindle.rex;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class RexApplication {

    public static void main(String[] args) {
        // No HTTP surface: the core runs its loops until the JVM is stopped
        new SpringApplicationBuilder(RexApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off",
                        "spring.main.keep-alive=true"
                )
                .run(args);
    }
}
