/**
 * Sessions pairing a JDBC connection with an optional transaction.
 */
package io.github.yok.sqlserverkit.session;
