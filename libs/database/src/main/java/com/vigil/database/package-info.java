/**
 * JDBC storage of the cluster event timeline.
 * <p>
 * The schema lives in {@code db/migration/timeline} and is applied by Flyway.
 */
package com.vigil.database;
