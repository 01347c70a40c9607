package com.barthel.fragility;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FragilityApplication {

    public static void main(String[] args) {
        SpringApplication.run(FragilityApplication.class, args);
    }

}
