package util;

/**
 * Console logger for diagnostics from worker threads. Each line is tagged with the id of the thread that printed it.
 */
public class Logger {

    private Logger() {
        // static methods only
    }

    public static void println(String s) {
        System.err.println("[" + Thread.currentThread().getId() + "] " + s);
    }
}
