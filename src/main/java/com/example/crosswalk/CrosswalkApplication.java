package com.example.crosswalk;

import com.example.crosswalk.config.CrosswalkProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CrosswalkProperties.class)
public class CrosswalkApplication {

	public static void main(String[] args) {
		SpringApplication.run(CrosswalkApplication.class, args);
	}

}
