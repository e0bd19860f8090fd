package com.example.feed_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FeedEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(FeedEngineApplication.class, args);
	}

}
