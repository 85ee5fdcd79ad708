/**
 * Utilities of the command-line front end.
 */
package io.github.yok.sqlserverkit.util;
