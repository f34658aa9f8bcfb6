package io.notelite.server;

/**
 * Process configuration parsed from CLI args.
 *
 * Supports:
 *  - dataDir:    root for the entity store, the history log and backups
 *  - configPath: optional JSON file with consistency tunables
 *  - statusPort: port of the read-only status endpoint, 0 disables it
 */
public record ServerConfig(
        String dataDir,
        String configPath,
        int statusPort
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --data-dir,    -d   <path>
     *   --config,      -c   <path>
     *   --status-port, -p   <port>
     *   --help,        -h
     */
    public static ServerConfig fromArgs(String[] args) {
        String dataDir = "./data";
        String configPath = null;
        int statusPort = 8080;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                case "--status-port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        statusPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid status-port: " + args[i]);
                        System.exit(1);
                    }
                    if (statusPort < 0 || statusPort > 65535) {
                        System.err.println("status-port out of range: " + statusPort);
                        System.exit(1);
                    }
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(dataDir, configPath, statusPort);
    }

    public boolean statusEnabled() {
        return statusPort > 0;
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: notelite [options]

            Options:
              --data-dir,    -d   Data directory (default: ./data)
              --config,      -c   Path to JSON consistency config (optional)
              --status-port, -p   Status endpoint port, 0 to disable (default: 8080)
              --help,        -h   Show this help message
            """);
        System.exit(0);
    }
}
