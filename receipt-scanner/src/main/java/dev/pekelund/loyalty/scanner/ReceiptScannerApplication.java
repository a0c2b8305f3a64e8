package dev.pekelund.loyalty.scanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot application entry point for the receipt scanning service.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ReceiptScannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReceiptScannerApplication.class, args);
    }
}
