package com.hivestate.migration;

/**
 * Connection coordinates of the migration targets.
 *
 * @param pgHost      PostgreSQL host
 * @param pgPort      PostgreSQL port
 * @param pgDatabase  PostgreSQL database name
 * @param pgUser      PostgreSQL user
 * @param pgPassword  PostgreSQL password, may be empty
 * @param redisHost   Redis host
 * @param redisPort   Redis port
 */
public record TargetConnection(
    String pgHost,
    int pgPort,
    String pgDatabase,
    String pgUser,
    String pgPassword,
    String redisHost,
    int redisPort
) {

    public String jdbcUrl() {
        return "jdbc:postgresql://" + pgHost + ":" + pgPort + "/" + pgDatabase;
    }

    @Override
    public String toString() {
        return "postgresql://" + pgUser + "@" + pgHost + ":" + pgPort + "/" + pgDatabase
                + ", redis://" + redisHost + ":" + redisPort;
    }
}
