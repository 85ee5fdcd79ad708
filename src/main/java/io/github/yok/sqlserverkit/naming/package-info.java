/**
 * Database name validation and escaping.
 *
 * <p>
 * {@link io.github.yok.sqlserverkit.naming.DatabaseNameValidator} checks raw strings against the
 * SQL Server rules for regular identifiers and produces
 * {@link io.github.yok.sqlserverkit.naming.DatabaseName} values. Only such values are ever
 * interpolated into administrative SQL statements.
 * </p>
 */
package io.github.yok.sqlserverkit.naming;
