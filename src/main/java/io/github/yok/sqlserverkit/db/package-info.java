/**
 * Administrative operations and command execution helpers on top of the SQL Server JDBC driver.
 *
 * <p>
 * {@link io.github.yok.sqlserverkit.db.DatabaseAdministration} holds the operations on an open
 * administrative connection, {@link io.github.yok.sqlserverkit.db.AsyncDatabaseAdministration}
 * their {@code CompletableFuture} variants and
 * {@link io.github.yok.sqlserverkit.db.DatabaseAdministrator} the same commands for a configured
 * connection URL.
 * </p>
 */
package io.github.yok.sqlserverkit.db;
