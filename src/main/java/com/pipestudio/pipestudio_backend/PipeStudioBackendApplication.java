package com.pipestudio.pipestudio_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PipeStudioBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(PipeStudioBackendApplication.class, args);
    }
}
