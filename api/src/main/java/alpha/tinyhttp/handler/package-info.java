/**
 * Request handlers and exception handlers.
 */
package alpha.tinyhttp.handler;
