package com.loglens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for LogLens search.
 *
 * LogLens stores syslog events in ClickHouse and lets operators explore them
 * with a pipeline search language:
 * - Pipe-separated search, filter, stats, sort, limit, table, dedup, rename and top stages
 * - Compilation to a single parameterized ClickHouse statement
 * - Field discovery over structured event data
 * - Dashboard variables bound into queries without string splicing
 */
@SpringBootApplication
@EnableScheduling
public class LogLensApplication {

    /**
     * Main entry point for the LogLens search service.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(LogLensApplication.class, args);
    }
}
