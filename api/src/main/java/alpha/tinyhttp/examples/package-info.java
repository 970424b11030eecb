/**
 * Example applications.
 */
package alpha.tinyhttp.examples;
