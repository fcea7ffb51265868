/**
 * Main application class for Shelf Scan
 *
 * @author William Callahan
 *
 * Features:
 * - Excludes default datasource auto-configuration; the rating store builds its own pool
 * - Enables scheduling for the rating store recovery probe
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.shelf_scan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(exclude = {
    DataSourceAutoConfiguration.class,
    DataSourceTransactionManagerAutoConfiguration.class,
    // No schema.sql runs against the read-only rating store
    SqlInitializationAutoConfiguration.class
})
@EnableScheduling
public class ShelfScanApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(ShelfScanApplication.class, args);
    }
}
