package com.GlobeLine.series_cache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SeriesCacheApplication {

	public static void main(String[] args) {
		SpringApplication.run(SeriesCacheApplication.class, args);
	}
}
