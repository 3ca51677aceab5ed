package com.example.printconnector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point for the print connector.
 * Only wires the application context; the print server plumbing is configured under the infrastructure layer.
 */
@SpringBootApplication
public class PrintConnectorApplication {

	/**
	 * Boots the Spring container and exposes the HTTP endpoints defined under the interfaces layer.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(PrintConnectorApplication.class, args);
	}

}
