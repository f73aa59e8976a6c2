package com.medicaledu.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MedicalEduApplication {

	public static void main(String[] args) {
		// all persisted timestamps and schedules are UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(MedicalEduApplication.class, args);
	}

}
