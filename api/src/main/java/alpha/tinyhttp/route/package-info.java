/**
 * Exact-path routing.
 */
package alpha.tinyhttp.route;
