package com.airline.warehouse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Airline Warehouse Loader.
 *
 * Reads a JSONL ingest file of customer, aircraft, airport and flight records, merges
 * the reference entities into SCD Type 2 dimensions, loads the flights into the fact
 * table and audits the result. The exit code reflects the status of the batch job.
 */
@SpringBootApplication
public class WarehouseLoaderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
            SpringApplication.run(WarehouseLoaderApplication.class, args)
        ));
    }
}
