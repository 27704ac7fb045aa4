package com.ogt.exposure;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OgtExposureServiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(OgtExposureServiceApplication.class, args);
	}

}
