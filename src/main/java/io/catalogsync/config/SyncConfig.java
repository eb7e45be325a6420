package io.catalogsync.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Run configuration, injected into the orchestrator and executors.
 */
@ConfigMapping(prefix = "catalogsync")
public interface SyncConfig {

    /**
     * Pool size of the course discovery and category resolution stages.
     */
    @WithDefault("16")
    int discoveryParallelism();

    /**
     * Pool size of the download stage. Kept well below the discovery pool.
     */
    @WithDefault("4")
    int downloadParallelism();

    @WithDefault(".catalog-cache.json")
    String cacheFileName();

    @WithDefault("true")
    boolean autoSelectLatestYear();

    @WithDefault("CLIP")
    String defaultDirectoryName();

    Auth auth();

    Catalog catalog();

    Transfer transfer();

    interface Auth {
        @WithDefault("3")
        int maxAttempts();

        Optional<String> username();

        Optional<String> password();
    }

    interface Catalog {
        /**
         * Root of the file-system mirror read by the local catalog browser.
         */
        Optional<String> localRoot();
    }

    interface Transfer {
        @WithDefault("8192")
        int bufferSize();
    }
}
