package com.libragraph.docmirror.core.config;

import com.libragraph.docmirror.core.sync.NameTieBreak;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Settings under {@code mirror.*}.
 */
@ConfigMapping(prefix = "mirror")
public interface MirrorConfig {

    /** Root directory of the content-addressed file cache. */
    String cacheRoot();

    /**
     * Comma-separated {@code extension:mime/type} pairs. A listed extension always uploads
     * with the given type, ahead of anything inferred from the file name.
     */
    @WithDefault("md:text/markdown,mdx:text/markdown,l:text/markdown,ss:text/markdown,sc:text/markdown")
    String uploadMimeTypes();

    Worker worker();

    Sync sync();

    interface Worker {

        /** Documents claimed per activation; also bounds upload concurrency. */
        @WithDefault("10")
        int batchSize();

        @WithDefault("PT5S")
        Duration pollInterval();

        /** Re-polls of a remote operation after the first status check. */
        @WithDefault("120")
        int maxPollAttempts();

        /**
         * Age after which a claim with no terminal result is considered abandoned.
         * Must exceed {@code poll-interval * max-poll-attempts}.
         */
        @WithDefault("PT15M")
        Duration claimLease();

        /** Period of the abandoned-claim sweep, in scheduler syntax. */
        @WithDefault("60s")
        String sweepInterval();
    }

    interface Sync {

        /** Representative documents listed per report bucket. */
        @WithDefault("5")
        int sampleSize();

        @WithDefault("FIRST_INSERTED")
        NameTieBreak nameTieBreak();
    }
}
