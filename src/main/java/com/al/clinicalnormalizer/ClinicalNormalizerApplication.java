package com.al.clinicalnormalizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ClinicalNormalizerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ClinicalNormalizerApplication.class, args);
	}

}
