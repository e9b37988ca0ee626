package com.tmdbsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "tmdbsync.runner")
@NoArgsConstructor
@Getter
@Setter
public class RunnerProperties {

    /** Run the catalog on startup. Tests switch this off. */
    private boolean enabled = true;

    /** Entities to run; empty runs the whole catalog. Always executed in catalog order. */
    private List<String> entities = new ArrayList<>();
}
