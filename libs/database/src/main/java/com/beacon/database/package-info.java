/**
 * PostgreSQL support for Beacon services.
 *
 * <p>Provides the {@code database} dependency clients probed by the status aggregator, the
 * request log written for every served request, and the Flyway schema migration that creates
 * the {@code requests} and {@code metrics} tables.
 *
 * <p>Classes here are POJOs without Spring annotations; services wire them in their own
 * configuration against the pooled {@link javax.sql.DataSource} owned by the application
 * context.
 */
package com.beacon.database;
