package com.wavesmith;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class WavesmithApplication {

    public static void main(String[] args) {
        // Library-style engine: no web server, callers drive it through the beans.
        new SpringApplicationBuilder(WavesmithApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
