package com.blocksub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlockSubApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlockSubApplication.class, args);
    }
}
