package ember;

import ember.db.Database;
import ember.server.EmberServer;
import ember.utils.Log;

/**
 * Server entry point. Usage: {@code ember [config.yaml]}
 */
public class Ember {

    public static void printBanner(Config config) {
        Log.info("\n" +
                "   ______          __             \n" +
                "  / ____/___ ___  / /_  ___  _____\n" +
                " / __/ / __ `__ \\/ __ \\/ _ \\/ ___/\n" +
                "/ /___/ / / / / / /_/ /  __/ /    \n" +
                "/_____/_/ /_/ /_/_.___/\\___/_/     \n" +
                "                                   \n" +
                " :: Ember ::        (v" + config.version + ") \n" +
                " :: Engine ::       Java " + System.getProperty("java.version") + "\n");
    }

    public static void main(String[] args) throws Exception {
        Config config = Config.load(args.length > 0 ? args[0] : Config.DEFAULT_FILE);
        if (!Boolean.getBoolean("ember.debug")) {
            Log.setLevel(config.logLevel);
        }
        printBanner(config);

        Database db = new Database();
        EmberServer server = new EmberServer(config, db);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("Shutting down...");
            server.stop();
        }, "ember-shutdown"));

        server.awaitTermination();
    }
}
