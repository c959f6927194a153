package com.example.lrucache.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lru")
public class LruCacheProperties {

    // Maximum number of resident entries
    private int capacity = 10;

    private final Workload workload = new Workload();

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public Workload getWorkload() {
        return workload;
    }

    /**
     * Shape of the writer/reader workload run at startup.
     */
    public static class Workload {
        private boolean enabled = false;
        private int writers = 3;
        private int readers = 3;
        private int keysPerThread = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWriters() {
            return writers;
        }

        public void setWriters(int writers) {
            this.writers = writers;
        }

        public int getReaders() {
            return readers;
        }

        public void setReaders(int readers) {
            this.readers = readers;
        }

        public int getKeysPerThread() {
            return keysPerThread;
        }

        public void setKeysPerThread(int keysPerThread) {
            this.keysPerThread = keysPerThread;
        }
    }
}
