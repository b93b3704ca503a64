package com.officeduty.backend;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class OfficeDutyApplication {

	public static void main(String[] args) {
		// Timestamps written by the service and read back by clients are all UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(OfficeDutyApplication.class, args);
	}

	/**
	 * Source of "now" for completion timestamps and health probes; tests pin it with a fixed clock.
	 */
	@Bean
	public Clock utcClock() {
		return Clock.system(ZoneOffset.UTC);
	}

}
