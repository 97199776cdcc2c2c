package ember;

import ember.db.Database;

import java.lang.management.ManagementFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public class EmberServerContext implements ServerContext {
    private final Config config;
    private final Database db;
    private final AtomicInteger activeConnections = new AtomicInteger(0);
    private final AtomicLong totalCommands = new AtomicLong(0);
    private volatile int boundPort;

    public EmberServerContext(Config config, Database db) {
        this.config = config;
        this.db = db;
        this.boundPort = config.port;
    }

    /** Records the port actually bound, which differs from the configured one when that is 0. */
    public void setBoundPort(int port) {
        this.boundPort = port;
    }

    @Override
    public String getVersion() {
        return config.version;
    }

    @Override
    public int getPort() {
        return boundPort;
    }

    @Override
    public long getUptime() {
        return ManagementFactory.getRuntimeMXBean().getUptime();
    }

    @Override
    public String getOsName() {
        return System.getProperty("os.name");
    }

    @Override
    public String getJavaVersion() {
        return System.getProperty("java.version");
    }

    @Override
    public int getActiveConnections() {
        return activeConnections.get();
    }

    @Override
    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }

    @Override
    public void connectionClosed() {
        activeConnections.decrementAndGet();
    }

    @Override
    public long getTotalCommandsProcessed() {
        return totalCommands.get();
    }

    @Override
    public void commandProcessed() {
        totalCommands.incrementAndGet();
    }

    @Override
    public Database getDatabase() {
        return db;
    }
}
