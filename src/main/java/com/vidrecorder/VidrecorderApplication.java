package com.vidrecorder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VidrecorderApplication {

    public static void main(String[] args) {
        SpringApplication.run(VidrecorderApplication.class, args);
    }
}
