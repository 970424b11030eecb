/**
 * Utilities.
 */
package alpha.tinyhttp.util;
