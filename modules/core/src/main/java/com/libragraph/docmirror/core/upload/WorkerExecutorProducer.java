package com.libragraph.docmirror.core.upload;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@ApplicationScoped
public class WorkerExecutorProducer {

    private ExecutorService executor;

    @Produces
    @ApplicationScoped
    @Named("uploadWorker")
    public ExecutorService uploadWorkerExecutor() {
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "upload-worker");
            t.setDaemon(true);
            return t;
        });
        return executor;
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) executor.shutdown();
    }
}
