package com.tmdbsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TmdbSyncApplication {

    public static void main(String[] args) {
        // Worker threads are not daemons; exit explicitly once the runner is done.
        System.exit(SpringApplication.exit(SpringApplication.run(TmdbSyncApplication.class, args)));
    }
}
