package org.ltiadvantage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.servlet.ServletComponentScan;

@ServletComponentScan
@SpringBootApplication
public class LtiToolApplication {

	// Scans this package for the annotated listener, filter and
	// servlets and starts the embedded Tomcat server
	public static void main(String[] args) {
		SpringApplication.run(LtiToolApplication.class, args);
	}

}
