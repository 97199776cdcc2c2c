package ember;

import ember.db.Database;

/**
 * What a command may see of the running server.
 */
public interface ServerContext {
    // Server
    String getVersion();
    int getPort();
    long getUptime();
    String getOsName();
    String getJavaVersion();

    // Clients
    int getActiveConnections();
    void connectionOpened();
    void connectionClosed();

    // Stats
    long getTotalCommandsProcessed();
    void commandProcessed();

    // Storage
    Database getDatabase();
}
